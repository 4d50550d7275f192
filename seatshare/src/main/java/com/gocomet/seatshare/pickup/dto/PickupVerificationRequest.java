package com.gocomet.seatshare.pickup.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PickupVerificationRequest {

    // Format (exactly 4 digits) is checked by the verification flow itself
    @NotNull(message = "PIN is required")
    private String pin;
}
