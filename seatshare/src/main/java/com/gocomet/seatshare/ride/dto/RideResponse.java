package com.gocomet.seatshare.ride.dto;

import com.gocomet.seatshare.ride.model.RideStatus;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RideResponse {

    private UUID id;
    private UUID driverId;
    private String fromAddress;
    private String toAddress;
    private LocalDateTime departureTime;
    private Integer publishedSeats;
    private Integer availableSeats;
    private BigDecimal pricePerSeat;
    private RideStatus status;
    private LocalDateTime createdAt;
}
