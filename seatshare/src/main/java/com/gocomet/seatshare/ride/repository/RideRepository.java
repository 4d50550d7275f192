package com.gocomet.seatshare.ride.repository;

import com.gocomet.seatshare.ride.model.Ride;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface RideRepository extends JpaRepository<Ride, UUID> {

    /**
     * Row-locks the ride for a status change. Callers that also lock bookings
     * take those first.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Ride r where r.id = :id")
    Optional<Ride> findByIdForUpdate(@Param("id") UUID id);

    @Query("select r.availableSeats from Ride r where r.id = :rideId")
    Optional<Integer> findAvailableSeats(@Param("rideId") UUID rideId);

    /**
     * Check-and-decrement in one statement. Returns 0 when the ride is missing
     * or holds fewer than {@code seats}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Ride r set r.availableSeats = r.availableSeats - :seats "
            + "where r.id = :rideId and r.availableSeats >= :seats")
    int decrementAvailableSeats(@Param("rideId") UUID rideId, @Param("seats") int seats);

    /**
     * Increment bounded by the published seat count. Returns 0 when the ride is
     * missing or the increment would overshoot.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Ride r set r.availableSeats = r.availableSeats + :seats "
            + "where r.id = :rideId and r.availableSeats + :seats <= r.publishedSeats")
    int incrementAvailableSeats(@Param("rideId") UUID rideId, @Param("seats") int seats);
}
