package com.community.moderation.model;

import com.community.moderation.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

public enum ReportStatus {
    PENDING("pending"),
    REVIEWING("reviewing"),
    RESOLVED("resolved");

    public static final Set<ReportStatus> OPEN = EnumSet.of(PENDING, REVIEWING);

    private final String code;

    ReportStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ReportStatus fromCode(String code) {
        for (ReportStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new ValidationException("Invalid report status: " + code);
    }
}
