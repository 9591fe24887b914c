package com.community.moderation.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends ModerationException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, "NOT_FOUND", message);
    }
}
