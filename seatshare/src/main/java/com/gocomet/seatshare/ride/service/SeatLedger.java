package com.gocomet.seatshare.ride.service;

import com.gocomet.seatshare.common.exception.InsufficientSeatsException;
import com.gocomet.seatshare.common.exception.ResourceNotFoundException;
import com.gocomet.seatshare.ride.repository.RideRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Sole writer of {@code rides.available_seats}.
 *
 * Every operation is a single conditional UPDATE, so the database row lock
 * decides which of two racing callers gets the last seats; the loser sees
 * zero rows updated and gets {@link InsufficientSeatsException}. Operations
 * join the caller's transaction so a failure rolls back the booking change
 * that triggered it.
 *
 * The updates clear the persistence context: callers must re-read any entity
 * they still need after a ledger call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeatLedger {

    private final RideRepository rideRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public void reserve(UUID rideId, int seats) {
        requirePositive(seats);
        int updated = rideRepository.decrementAvailableSeats(rideId, seats);
        if (updated == 0) {
            int available = currentAvailableSeats(rideId);
            log.info("Reservation of {} seat(s) on ride {} refused, {} available", seats, rideId, available);
            throw new InsufficientSeatsException(rideId, seats, available);
        }
        log.debug("Reserved {} seat(s) on ride {}", seats, rideId);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void release(UUID rideId, int seats) {
        requirePositive(seats);
        int updated = rideRepository.incrementAvailableSeats(rideId, seats);
        if (updated == 0) {
            int available = currentAvailableSeats(rideId);
            log.error("Release of {} seat(s) on ride {} would exceed its published seats ({} available)",
                    seats, rideId, available);
            throw new IllegalStateException("Seat release exceeds published inventory for ride " + rideId);
        }
        log.debug("Released {} seat(s) on ride {}", seats, rideId);
    }

    /**
     * Signed change for a confirmed booking whose seat count was edited.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void adjust(UUID rideId, int delta) {
        if (delta > 0) {
            reserve(rideId, delta);
        } else if (delta < 0) {
            release(rideId, -delta);
        }
    }

    private int currentAvailableSeats(UUID rideId) {
        return rideRepository.findAvailableSeats(rideId)
                .orElseThrow(() -> new ResourceNotFoundException("Ride", "id", rideId));
    }

    private static void requirePositive(int seats) {
        if (seats < 1) {
            throw new IllegalArgumentException("Seat count must be at least 1, got " + seats);
        }
    }
}
