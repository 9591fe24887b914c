package com.community.moderation.model;

import com.community.moderation.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 严重程度，rank 越大越严重（队列排序依赖该值）
 */
public enum Severity {
    LOW("low", 1, 1.0),
    MEDIUM("medium", 2, 1.5),
    HIGH("high", 3, 2.0),
    CRITICAL("critical", 4, 3.0);

    // 分数区间上界
    private static final double MEDIUM_FLOOR = 0.4;
    private static final double HIGH_FLOOR = 0.6;
    private static final double CRITICAL_FLOOR = 0.85;

    private final String code;
    private final int rank;
    // 信誉扣减倍率
    private final double reputationMultiplier;

    Severity(String code, int rank, double reputationMultiplier) {
        this.code = code;
        this.rank = rank;
        this.reputationMultiplier = reputationMultiplier;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getRank() {
        return rank;
    }

    public double getReputationMultiplier() {
        return reputationMultiplier;
    }

    /**
     * 按风险分数映射严重程度：<0.4 low, <0.6 medium, <0.85 high, 其余 critical
     */
    public static Severity fromScore(double score) {
        if (score < MEDIUM_FLOOR) {
            return LOW;
        } else if (score < HIGH_FLOOR) {
            return MEDIUM;
        } else if (score < CRITICAL_FLOOR) {
            return HIGH;
        } else {
            return CRITICAL;
        }
    }

    @JsonCreator
    public static Severity fromCode(String code) {
        for (Severity severity : values()) {
            if (severity.code.equalsIgnoreCase(code)) {
                return severity;
            }
        }
        throw new ValidationException("Invalid severity: " + code);
    }
}
