package com.community.moderation.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 优化项实施成本，costFactor 用于优先级计算的分母
 */
public enum ImplementationCost {
    LOW("low", 1.0),
    MEDIUM("medium", 1.5),
    HIGH("high", 2.0);

    private final String code;
    private final double costFactor;

    ImplementationCost(String code, double costFactor) {
        this.code = code;
        this.costFactor = costFactor;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public double getCostFactor() {
        return costFactor;
    }
}
