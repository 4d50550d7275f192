package com.gocomet.seatshare.booking.repository;

import com.gocomet.seatshare.booking.model.Booking;
import com.gocomet.seatshare.booking.model.BookingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BookingRepository extends JpaRepository<Booking, UUID> {

    boolean existsByRiderIdAndRideIdAndStatusIn(UUID riderId, UUID rideId, Collection<BookingStatus> statuses);

    List<Booking> findByRiderIdOrderByCreatedAtDesc(UUID riderId);

    List<Booking> findByRideIdOrderByCreatedAtAsc(UUID rideId);

    List<Booking> findByRideIdAndStatusIn(UUID rideId, Collection<BookingStatus> statuses);

    boolean existsByConfirmationNumber(String confirmationNumber);

    /**
     * Row-locks the booking for the rest of the transaction. Every booking
     * mutation goes through this so transitions and PIN attempt counters on
     * one booking are serialized. Bookings are always locked before the ride
     * row the ledger updates.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from Booking b where b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from Booking b where b.ride.id = :rideId and b.status in :statuses order by b.createdAt")
    List<Booking> findByRideIdAndStatusInForUpdate(@Param("rideId") UUID rideId,
                                                   @Param("statuses") Collection<BookingStatus> statuses);
}
