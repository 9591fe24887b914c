package com.community.moderation.analytics;

import com.community.moderation.config.ModerationProperties;
import com.community.moderation.dto.analytics.PredictiveAlert;
import com.community.moderation.dto.analytics.Timeframe;
import com.community.moderation.dto.analytics.TrendPrediction;
import com.community.moderation.model.AlertType;
import com.community.moderation.model.Severity;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 预测告警：指标朝不利方向变化超过阈值，且趋势置信度不低于配置下限时触发
 */
@Component
public class AlertPredictor {

    // 触发告警的最小相对变化
    static final double ALERT_CHANGE = 0.25;
    private static final double HIGH_CHANGE = 0.5;
    private static final double CRITICAL_CHANGE = 1.0;

    private final ModerationProperties properties;

    public AlertPredictor(ModerationProperties properties) {
        this.properties = properties;
    }

    public List<PredictiveAlert> predict(List<TrendPrediction> trends, Timeframe timeframe, LocalDateTime now) {
        double floor = properties.getAnalytics().getAlertConfidenceFloor();
        List<PredictiveAlert> alerts = new ArrayList<>();
        for (TrendPrediction trend : trends) {
            AlertType type = AlertType.forMetric(trend.getMetric());
            if (type == null || trend.getTrend() != type.getAdverseDirection()) {
                continue;
            }
            double magnitude = Math.abs(trend.getChangeRate());
            if (magnitude < ALERT_CHANGE || trend.getConfidence() < floor) {
                continue;
            }
            alerts.add(toAlert(type, trend, magnitude, timeframe, now));
        }
        alerts.sort(Comparator.comparingInt((PredictiveAlert alert) -> alert.getSeverity().getRank()).reversed()
                .thenComparing(PredictiveAlert::getId));
        return alerts;
    }

    private PredictiveAlert toAlert(AlertType type, TrendPrediction trend, double magnitude,
                                    Timeframe timeframe, LocalDateTime now) {
        PredictiveAlert alert = new PredictiveAlert();
        // 同一窗口同一类型的告警 id 固定
        alert.setId("alert_" + type.getCode() + "_" + timeframe.getEnd().toEpochSecond(ZoneOffset.UTC));
        alert.setType(type);
        alert.setSeverity(severityOf(magnitude));
        alert.setMetric(trend.getMetric());
        alert.setPrediction(String.format(Locale.ROOT, "%s expected to %s by %.0f%% over the %s (predicted %.4f)",
                trend.getMetric(),
                trend.getChangeRate() > 0 ? "rise" : "fall",
                magnitude * 100,
                trend.getTimeframe(),
                trend.getPredictedValue()));
        alert.setProbability(trend.getConfidence());
        alert.setTimeframe(trend.getTimeframe());
        alert.setCreatedAt(now);

        switch (type) {
            case VOLUME_SPIKE:
                alert.setImpact("Potential queue backlog and increased response times");
                alert.setRecommendedActions(List.of(
                        "Prepare additional moderator coverage",
                        "Review automation thresholds for low-risk content",
                        "Monitor queue backlog closely"));
                break;
            case QUALITY_DROP:
                alert.setImpact("Higher moderation workload and degraded reading experience");
                alert.setRecommendedActions(List.of(
                        "Show posting guidelines to new authors",
                        "Tighten low-quality rules temporarily",
                        "Schedule a content quality campaign"));
                break;
            case FALSE_POSITIVE_INCREASE:
                alert.setImpact("Legitimate content is being blocked or delayed");
                alert.setRecommendedActions(List.of(
                        "Review rules most often rated too strict",
                        "Check cultural calibration for bilingual content",
                        "Sample recent blocks for manual audit"));
                break;
            case COMMUNITY_DISAGREEMENT:
                alert.setImpact("Community trust in moderation decisions is eroding");
                alert.setRecommendedActions(List.of(
                        "Review recently overturned decisions",
                        "Gather more community feedback on borderline cases",
                        "Publish moderation guidelines updates"));
                break;
            case SYSTEM_OVERLOAD:
                alert.setImpact("Slower evaluations and scorer timeouts falling back to review");
                alert.setRecommendedActions(List.of(
                        "Increase scorer pool size",
                        "Check scorer latency and timeout settings",
                        "Shed non-critical analytics load"));
                break;
            default:
                alert.setImpact("Unknown");
        }
        return alert;
    }

    private Severity severityOf(double magnitude) {
        if (magnitude >= CRITICAL_CHANGE) {
            return Severity.CRITICAL;
        }
        if (magnitude >= HIGH_CHANGE) {
            return Severity.HIGH;
        }
        return Severity.MEDIUM;
    }
}
