package com.community.moderation.exception;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends ModerationException {

    public ForbiddenException(String message) {
        super(HttpStatus.FORBIDDEN, "FORBIDDEN", message);
    }
}
