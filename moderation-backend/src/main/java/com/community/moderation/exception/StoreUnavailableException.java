package com.community.moderation.exception;

import org.springframework.http.HttpStatus;

public class StoreUnavailableException extends ModerationException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", message, cause);
    }
}
