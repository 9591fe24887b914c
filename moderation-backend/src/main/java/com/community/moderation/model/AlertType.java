package com.community.moderation.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 预测告警类型。每种类型绑定一个被监控指标及其“变坏”的方向。
 */
public enum AlertType {
    VOLUME_SPIKE("volume_spike", "content_volume", TrendDirection.INCREASING),
    QUALITY_DROP("quality_drop", "average_quality", TrendDirection.DECREASING),
    FALSE_POSITIVE_INCREASE("false_positive_increase", "false_positive_rate", TrendDirection.INCREASING),
    COMMUNITY_DISAGREEMENT("community_disagreement", "community_agreement_rate", TrendDirection.DECREASING),
    SYSTEM_OVERLOAD("system_overload", "response_time", TrendDirection.INCREASING);

    private final String code;
    private final String metric;
    private final TrendDirection adverseDirection;

    AlertType(String code, String metric, TrendDirection adverseDirection) {
        this.code = code;
        this.metric = metric;
        this.adverseDirection = adverseDirection;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getMetric() {
        return metric;
    }

    public TrendDirection getAdverseDirection() {
        return adverseDirection;
    }

    public static AlertType forMetric(String metric) {
        for (AlertType type : values()) {
            if (type.metric.equals(metric)) {
                return type;
            }
        }
        return null;
    }
}
