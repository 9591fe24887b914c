package com.community.moderation.model;

import com.community.moderation.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * 队列状态机：pending -> reviewing -> {approved, rejected}
 */
public enum QueueStatus {
    PENDING("pending"),
    REVIEWING("reviewing"),
    APPROVED("approved"),
    REJECTED("rejected");

    public static final Set<QueueStatus> ACTIVE = EnumSet.of(PENDING, REVIEWING);

    private final String code;

    QueueStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED;
    }

    @JsonCreator
    public static QueueStatus fromCode(String code) {
        for (QueueStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new ValidationException("Invalid queue status: " + code);
    }
}
