package com.gocomet.seatshare.common.exception;

import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;

public class CredentialExpiredException extends BusinessException {

    public CredentialExpiredException(LocalDateTime expiredAt) {
        super("CREDENTIAL_EXPIRED", HttpStatus.GONE, "Pickup PIN has expired");
        detail("expiredAt", expiredAt);
    }
}
