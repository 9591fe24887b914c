package com.community.moderation.exception;

import org.springframework.http.HttpStatus;

/**
 * 冲突：重复的活动队列项（409）或重复举报（400）
 */
public class ConflictException extends ModerationException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, "CONFLICT", message);
    }

    protected ConflictException(HttpStatus status, String errorCode, String message) {
        super(status, errorCode, message);
    }

    public static ConflictException duplicateReport(String contentId) {
        return new ConflictException(HttpStatus.BAD_REQUEST, "DUPLICATE_REPORT",
                "You have already reported this content: " + contentId);
    }
}
