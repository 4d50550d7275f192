package com.gocomet.seatshare.common.exception;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends BusinessException {

    public ResourceNotFoundException(String message) {
        super("NOT_FOUND", HttpStatus.NOT_FOUND, message);
    }

    public ResourceNotFoundException(String resource, String field, Object value) {
        this(String.format("%s not found with %s: %s", resource, field, value));
    }
}
