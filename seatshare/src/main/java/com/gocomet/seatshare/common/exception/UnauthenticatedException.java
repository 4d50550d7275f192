package com.gocomet.seatshare.common.exception;

import org.springframework.http.HttpStatus;

public class UnauthenticatedException extends BusinessException {

    public UnauthenticatedException(String message) {
        super("UNAUTHENTICATED", HttpStatus.UNAUTHORIZED, message);
    }
}
