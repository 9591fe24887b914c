package com.community.moderation.model;

import com.community.moderation.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReportCategory {
    SPAM("spam"),
    INAPPROPRIATE("inappropriate"),
    HARASSMENT("harassment"),
    FAKE("fake"),
    MISINFORMATION("misinformation"),
    OTHER("other");

    private final String code;

    ReportCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 举报优先级由类别决定：misinformation -> urgent；harassment/fake -> high；其余 medium
     */
    public ReportPriority derivePriority() {
        if (this == MISINFORMATION) {
            return ReportPriority.URGENT;
        }
        if (this == HARASSMENT || this == FAKE) {
            return ReportPriority.HIGH;
        }
        return ReportPriority.MEDIUM;
    }

    @JsonCreator
    public static ReportCategory fromCode(String code) {
        for (ReportCategory category : values()) {
            if (category.code.equalsIgnoreCase(code)) {
                return category;
            }
        }
        throw new ValidationException("Invalid report category: " + code);
    }
}
