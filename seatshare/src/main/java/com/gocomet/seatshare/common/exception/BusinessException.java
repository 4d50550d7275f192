package com.gocomet.seatshare.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for expected, business-rule failures. These are surfaced to the
 * caller as-is (code + message + details), unlike internal failures which are
 * reduced to a generic message by {@link GlobalExceptionHandler}.
 */
@Getter
public abstract class BusinessException extends RuntimeException {

    private final String code;
    private final HttpStatus status;
    private final Map<String, Object> details = new LinkedHashMap<>();

    protected BusinessException(String code, HttpStatus status, String message) {
        super(message);
        this.code = code;
        this.status = status;
    }

    protected BusinessException detail(String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
        return this;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }
}
