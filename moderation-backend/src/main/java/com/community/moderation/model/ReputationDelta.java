package com.community.moderation.model;

import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

/**
 * 一次信誉增量：只调整涉及的因子，不做全量重算
 */
@Data
public class ReputationDelta {

    private final String reason;

    private final Map<ReputationFactor, Double> changes = new EnumMap<>(ReputationFactor.class);

    // 是否记为一次处罚
    private boolean strike;

    public ReputationDelta(String reason) {
        this.reason = reason;
    }

    public ReputationDelta add(ReputationFactor factor, double amount) {
        changes.merge(factor, amount, Double::sum);
        return this;
    }

    public double get(ReputationFactor factor) {
        return changes.getOrDefault(factor, 0.0);
    }
}
