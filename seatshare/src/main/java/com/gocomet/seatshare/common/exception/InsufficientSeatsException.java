package com.gocomet.seatshare.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * The ride cannot cover the requested seats. An expected outcome of losing a
 * race for the last seats, not a system error.
 */
@Getter
public class InsufficientSeatsException extends BusinessException {

    private final UUID rideId;
    private final int requestedSeats;
    private final int availableSeats;

    public InsufficientSeatsException(UUID rideId, int requestedSeats, int availableSeats) {
        super("INSUFFICIENT_SEATS", HttpStatus.CONFLICT, String.format(
                "Not enough available seats. Requested %d, only %d available.", requestedSeats, availableSeats));
        this.rideId = rideId;
        this.requestedSeats = requestedSeats;
        this.availableSeats = availableSeats;
        detail("rideId", rideId);
        detail("requestedSeats", requestedSeats);
        detail("availableSeats", availableSeats);
    }
}
