package com.gocomet.seatshare.booking.dto;

import jakarta.validation.constraints.Min;
import lombok.*;

/**
 * Partial update; null fields are left unchanged.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UpdateBookingRequest {

    @Min(value = 1, message = "Number of seats must be at least 1")
    private Integer numberOfSeats;

    private String pickupAddress;
    private Double pickupLat;
    private Double pickupLng;
}
