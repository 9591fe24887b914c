package com.community.moderation.model;

import com.community.moderation.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/**
 * 分析窗口长度。month 固定按 30 天计算，保证历史窗口等长。
 */
public enum AnalyticsPeriod {
    HOUR("hour", Duration.ofHours(1)),
    DAY("day", Duration.ofDays(1)),
    WEEK("week", Duration.ofDays(7)),
    MONTH("month", Duration.ofDays(30)),
    CUSTOM("custom", null);

    private final String code;
    private final Duration duration;

    AnalyticsPeriod(String code, Duration duration) {
        this.code = code;
        this.duration = duration;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Duration getDuration() {
        return duration;
    }

    public static AnalyticsPeriod fromCode(String code) {
        for (AnalyticsPeriod period : values()) {
            if (period != CUSTOM && period.code.equalsIgnoreCase(code)) {
                return period;
            }
        }
        throw new ValidationException("Invalid period: " + code + " (expected hour, day, week or month)");
    }
}
