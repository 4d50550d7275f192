package com.gocomet.seatshare.common.exception;

import org.springframework.http.HttpStatus;

public class InvalidCredentialFormatException extends BusinessException {

    public InvalidCredentialFormatException() {
        super("INVALID_CREDENTIAL_FORMAT", HttpStatus.BAD_REQUEST, "PIN must be exactly 4 digits");
    }
}
