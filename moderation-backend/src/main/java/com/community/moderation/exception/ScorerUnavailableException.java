package com.community.moderation.exception;

import org.springframework.http.HttpStatus;

/**
 * 外部打分服务超时或失败。调用方应降级为 review，而不是 allow。
 */
public class ScorerUnavailableException extends ModerationException {

    public ScorerUnavailableException(String message) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "SCORER_UNAVAILABLE", message);
    }

    public ScorerUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "SCORER_UNAVAILABLE", message, cause);
    }
}
