package com.gocomet.seatshare.pickup.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.pickup-pin")
@Getter
@Setter
public class PickupPinProperties {

    public static final String DEVELOPMENT_SECRET = "default-secret-key-change-in-production";

    /** Server-held secret the reversible PIN form is keyed by. */
    private String secret;

    /** Hex-encoded salt for the key derivation. */
    private String salt = "5c0744940b5c369b";

    private Duration validity = Duration.ofHours(24);

    private int maxAttempts = 5;

    private Duration lockout = Duration.ofMinutes(10);

    private int bcryptStrength = 10;
}
