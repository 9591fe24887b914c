package com.community.moderation.exception;

import org.springframework.http.HttpStatus;

public class AuthException extends ModerationException {

    public AuthException(String message) {
        super(HttpStatus.UNAUTHORIZED, "AUTH_ERROR", message);
    }
}
