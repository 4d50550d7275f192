package com.gocomet.seatshare.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;

@Getter
public class CredentialLockedException extends BusinessException {

    private final LocalDateTime lockedUntil;

    public CredentialLockedException(LocalDateTime lockedUntil, long minutesRemaining) {
        super("CREDENTIAL_LOCKED", HttpStatus.TOO_MANY_REQUESTS, String.format(
                "Too many failed attempts. Please try again in %d minute%s",
                minutesRemaining, minutesRemaining != 1 ? "s" : ""));
        this.lockedUntil = lockedUntil;
        detail("lockedUntil", lockedUntil);
    }
}
