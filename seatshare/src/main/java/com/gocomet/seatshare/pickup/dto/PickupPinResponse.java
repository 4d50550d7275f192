package com.gocomet.seatshare.pickup.dto;

import com.gocomet.seatshare.booking.model.PickupStatus;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PickupPinResponse {

    private UUID bookingId;
    private String pin;
    private LocalDateTime expiresAt;
    private PickupStatus pickupStatus;
}
