package com.gocomet.seatshare.booking.dto;

import com.gocomet.seatshare.booking.model.BookingStatus;
import com.gocomet.seatshare.booking.model.PickupStatus;
import com.gocomet.seatshare.ride.model.RideStatus;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BookingResponse {

    private UUID id;
    private String confirmationNumber;
    private UUID rideId;
    private UUID riderId;
    private Integer numberOfSeats;
    private String pickupAddress;
    private Double pickupLat;
    private Double pickupLng;
    private BookingStatus status;
    private PickupStatus pickupStatus;
    private LocalDateTime pickedUpAt;
    private LocalDateTime pickupPinExpiresAt;
    private RideStatus rideStatus;
    private Integer rideAvailableSeats;
    private String paymentAuthorizationRef;
    private LocalDateTime createdAt;
}
