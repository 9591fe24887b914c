package com.community.moderation.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends ModerationException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
    }
}
