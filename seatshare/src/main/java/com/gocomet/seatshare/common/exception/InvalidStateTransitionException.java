package com.gocomet.seatshare.common.exception;

import org.springframework.http.HttpStatus;

public class InvalidStateTransitionException extends BusinessException {

    public InvalidStateTransitionException(String message) {
        super("INVALID_STATE", HttpStatus.CONFLICT, message);
    }

    public InvalidStateTransitionException(String entity, String currentState, String targetState) {
        this(String.format("Cannot transition %s from %s to %s", entity, currentState, targetState));
        detail("currentState", currentState);
        detail("targetState", targetState);
    }
}
