package com.gocomet.seatshare.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class CredentialMismatchException extends BusinessException {

    private final int attemptsRemaining;

    public CredentialMismatchException(int attemptsRemaining) {
        super("CREDENTIAL_MISMATCH", HttpStatus.UNAUTHORIZED, "Invalid PIN");
        this.attemptsRemaining = attemptsRemaining;
        detail("attemptsRemaining", attemptsRemaining);
    }
}
