package com.gocomet.seatshare.pickup.service;

import com.gocomet.seatshare.common.exception.InvalidCredentialFormatException;
import com.gocomet.seatshare.pickup.config.PickupPinProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.encrypt.Encryptors;
import org.springframework.security.crypto.encrypt.TextEncryptor;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Issues and checks the 4-digit pickup PIN.
 *
 * Each PIN is stored twice: a BCrypt hash, the only thing verification looks
 * at, and an AES-GCM ciphertext (key derived with PBKDF2 from the server
 * secret) so the rider's app can display it.
 */
@Service
@Slf4j
public class PickupCredentialService {

    private static final Pattern PIN_FORMAT = Pattern.compile("^\\d{4}$");
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Set<String> WEAK_PINS = buildWeakPins();

    private final PickupPinProperties properties;
    private final Clock clock;
    private final BCryptPasswordEncoder pinEncoder;
    private final TextEncryptor pinEncryptor;

    public PickupCredentialService(PickupPinProperties properties, Clock clock, Environment environment) {
        this.properties = properties;
        this.clock = clock;
        this.pinEncoder = new BCryptPasswordEncoder(properties.getBcryptStrength(), SECURE_RANDOM);
        this.pinEncryptor = Encryptors.delux(resolveSecret(properties, environment), properties.getSalt());
    }

    /**
     * Draw a new PIN and derive both stored forms from it, valid from now for
     * the configured window.
     */
    public PickupCredential issue() {
        String pin = generatePin();
        LocalDateTime expiresAt = now().plus(properties.getValidity());
        return new PickupCredential(pinEncoder.encode(pin), encrypt(pin), expiresAt);
    }

    public String generatePin() {
        String pin;
        do {
            pin = String.format("%04d", SECURE_RANDOM.nextInt(10_000));
        } while (isWeak(pin));
        return pin;
    }

    public boolean matches(String submittedPin, String pinHash) {
        return pinHash != null && pinEncoder.matches(submittedPin, pinHash);
    }

    public String encrypt(String pin) {
        return pinEncryptor.encrypt(pin);
    }

    public String decrypt(String encryptedPin) {
        return pinEncryptor.decrypt(encryptedPin);
    }

    public void requireValidFormat(String submittedPin) {
        if (submittedPin == null || !PIN_FORMAT.matcher(submittedPin).matches()) {
            throw new InvalidCredentialFormatException();
        }
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public LocalDateTime lockoutEndingFrom(LocalDateTime now) {
        return now.plus(properties.getLockout());
    }

    public int maxAttempts() {
        return properties.getMaxAttempts();
    }

    /** Repeated digits, plus ascending and descending runs such as 1234 and 9876. */
    public static boolean isWeak(String pin) {
        return WEAK_PINS.contains(pin);
    }

    private static Set<String> buildWeakPins() {
        Set<String> weak = new HashSet<>();
        for (int d = 0; d <= 9; d++) {
            weak.add(String.valueOf(d).repeat(4));
        }
        for (int start = 0; start <= 6; start++) {
            StringBuilder ascending = new StringBuilder();
            StringBuilder descending = new StringBuilder();
            for (int i = 0; i < 4; i++) {
                ascending.append(start + i);
                descending.append(9 - start - i);
            }
            weak.add(ascending.toString());
            weak.add(descending.toString());
        }
        return Set.copyOf(weak);
    }

    private static String resolveSecret(PickupPinProperties properties, Environment environment) {
        String secret = properties.getSecret();
        if (secret != null && !secret.isBlank()) {
            return secret;
        }
        if (environment.acceptsProfiles(Profiles.of("prod"))) {
            throw new IllegalStateException("app.pickup-pin.secret is required in production");
        }
        log.warn("app.pickup-pin.secret not set. Using the development default.");
        return PickupPinProperties.DEVELOPMENT_SECRET;
    }
}
