package com.gocomet.seatshare.ride.dto;

import jakarta.validation.constraints.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PublishRideRequest {

    @NotBlank(message = "From address is required")
    private String fromAddress;

    @NotBlank(message = "To address is required")
    private String toAddress;

    @NotNull(message = "Departure time is required")
    @Future(message = "Departure time must be in the future")
    private LocalDateTime departureTime;

    @NotNull(message = "Seat count is required")
    @Min(value = 1, message = "Available seats must be between 1 and 8")
    @Max(value = 8, message = "Available seats must be between 1 and 8")
    private Integer seats;

    @NotNull(message = "Price per seat is required")
    @DecimalMin(value = "0.00", message = "Price per seat must be a positive number")
    private BigDecimal pricePerSeat;
}
