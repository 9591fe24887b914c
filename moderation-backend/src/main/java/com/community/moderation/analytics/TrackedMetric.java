package com.community.moderation.analytics;

import com.community.moderation.dto.analytics.OverviewMetrics;

import java.util.function.ToDoubleFunction;

/**
 * 参与趋势分析的指标：取值函数 + 样本量函数
 */
public enum TrackedMetric {
    CONTENT_VOLUME("content_volume", "Content volume", false,
            m -> m.getContentVolumeProcessed(), m -> m.getContentVolumeProcessed()),
    TOTAL_ACTIONS("total_actions", "Moderation actions", false,
            m -> m.getTotalActions(), m -> m.getTotalActions()),
    ACCURACY_RATE("accuracy_rate", "Accuracy rate", true,
            OverviewMetrics::getAccuracyRate, m -> m.getFeedbackVotes()),
    FALSE_POSITIVE_RATE("false_positive_rate", "False positive rate", true,
            OverviewMetrics::getFalsePositiveRate, m -> m.getFeedbackVotes()),
    COMMUNITY_AGREEMENT_RATE("community_agreement_rate", "Community agreement rate", true,
            OverviewMetrics::getCommunityAgreementRate, m -> m.getFeedbackVotes()),
    AUTOMATION_RATE("automation_rate", "Automation rate", true,
            OverviewMetrics::getAutomationRate, m -> m.getContentVolumeProcessed()),
    RESPONSE_TIME("response_time", "Response time", false,
            OverviewMetrics::getResponseTime, m -> m.getContentVolumeProcessed()),
    AVERAGE_QUALITY("average_quality", "Average content quality", true,
            OverviewMetrics::getAverageQualityScore, m -> m.getContentVolumeProcessed());

    private final String code;
    private final String displayName;
    // 比率类指标，预测值截断在 [0, 1]
    private final boolean rate;
    private final ToDoubleFunction<OverviewMetrics> value;
    private final ToDoubleFunction<OverviewMetrics> samples;

    TrackedMetric(String code, String displayName, boolean rate,
                  ToDoubleFunction<OverviewMetrics> value, ToDoubleFunction<OverviewMetrics> samples) {
        this.code = code;
        this.displayName = displayName;
        this.rate = rate;
        this.value = value;
        this.samples = samples;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isRate() {
        return rate;
    }

    public double valueOf(OverviewMetrics metrics) {
        return value.applyAsDouble(metrics);
    }

    public long samplesOf(OverviewMetrics metrics) {
        return (long) samples.applyAsDouble(metrics);
    }
}
