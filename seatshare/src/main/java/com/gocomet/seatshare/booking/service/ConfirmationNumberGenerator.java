package com.gocomet.seatshare.booking.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.function.Predicate;

/**
 * Human-readable booking reference, format SS-YYYYMMDD-XXXXXX.
 */
@Component
@RequiredArgsConstructor
public class ConfirmationNumberGenerator {

    private static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int SUFFIX_LENGTH = 6;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Clock clock;

    public String next() {
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return "SS-" + LocalDate.now(clock).format(DateTimeFormatter.BASIC_ISO_DATE) + "-" + suffix;
    }

    /**
     * Draws until {@code taken} rejects the candidate. With 32^6 suffixes per
     * day a second draw is already rare.
     */
    public String nextUnique(Predicate<String> taken) {
        String candidate;
        do {
            candidate = next();
        } while (taken.test(candidate));
        return candidate;
    }
}
