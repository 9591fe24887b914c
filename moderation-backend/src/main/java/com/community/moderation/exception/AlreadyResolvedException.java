package com.community.moderation.exception;

import org.springframework.http.HttpStatus;

public class AlreadyResolvedException extends ModerationException {

    public AlreadyResolvedException(String message) {
        super(HttpStatus.CONFLICT, "ALREADY_RESOLVED", message);
    }
}
