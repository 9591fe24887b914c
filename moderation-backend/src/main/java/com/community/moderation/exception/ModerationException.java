package com.community.moderation.exception;

import org.springframework.http.HttpStatus;

/**
 * 审核子系统异常基类，携带 HTTP 状态和错误码，由 GlobalExceptionHandler 统一转换为响应信封。
 */
public class ModerationException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public ModerationException(HttpStatus status, String errorCode, String message) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public ModerationException(HttpStatus status, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
