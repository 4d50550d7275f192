package com.gocomet.seatshare.pickup.service;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * The two stored forms of a freshly issued pickup PIN. The plaintext is not
 * part of it.
 */
@Value
public class PickupCredential {

    String hash;
    String encrypted;
    LocalDateTime expiresAt;

    @Override
    public String toString() {
        return "PickupCredential{hash='[REDACTED]', encrypted='[REDACTED]', expiresAt=" + expiresAt + "}";
    }
}
