package com.community.moderation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String code;

    TrendDirection(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
