package com.community.moderation.analytics;

import com.community.moderation.config.ModerationProperties;
import com.community.moderation.dto.analytics.PredictiveAlert;
import com.community.moderation.dto.analytics.Timeframe;
import com.community.moderation.dto.analytics.TrendPrediction;
import com.community.moderation.model.AlertType;
import com.community.moderation.model.AnalyticsPeriod;
import com.community.moderation.model.Severity;
import com.community.moderation.model.TrendDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertPredictorTest {

    private static final LocalDateTime END = LocalDateTime.of(2025, 3, 10, 0, 0);

    private AlertPredictor predictor;
    private Timeframe timeframe;

    @BeforeEach
    void setUp() {
        predictor = new AlertPredictor(new ModerationProperties());
        timeframe = new Timeframe(AnalyticsPeriod.DAY, END.minusDays(1), END);
    }

    @Test
    void testVolumeSpikeAlert() {
        List<PredictiveAlert> alerts = predictor.predict(
                List.of(trend("content_volume", TrendDirection.INCREASING, 0.3, 0.9)), timeframe, END);

        assertEquals(1, alerts.size());
        PredictiveAlert alert = alerts.get(0);
        assertEquals(AlertType.VOLUME_SPIKE, alert.getType());
        assertEquals(Severity.MEDIUM, alert.getSeverity());
        assertEquals("alert_volume_spike_1741564800", alert.getId());
        assertEquals(0.9, alert.getProbability(), 1e-9);
        assertEquals(3, alert.getRecommendedActions().size());
        assertTrue(alert.getPrediction().startsWith("content_volume expected to rise by 30%"));
    }

    // 变化幅度决定严重程度
    @Test
    void testSeverityByMagnitude() {
        List<PredictiveAlert> alerts = predictor.predict(List.of(
                trend("response_time", TrendDirection.INCREASING, 1.2, 0.8),
                trend("average_quality", TrendDirection.DECREASING, -0.6, 0.8),
                trend("false_positive_rate", TrendDirection.INCREASING, 0.25, 0.8)), timeframe, END);

        assertEquals(3, alerts.size());
        assertEquals(Severity.CRITICAL, alerts.get(0).getSeverity());
        assertEquals(AlertType.SYSTEM_OVERLOAD, alerts.get(0).getType());
        assertEquals(Severity.HIGH, alerts.get(1).getSeverity());
        assertEquals(AlertType.QUALITY_DROP, alerts.get(1).getType());
        assertEquals(Severity.MEDIUM, alerts.get(2).getSeverity());
    }

    // 同一严重程度按 id 排序
    @Test
    void testSameSeveritySortedById() {
        List<PredictiveAlert> alerts = predictor.predict(List.of(
                trend("content_volume", TrendDirection.INCREASING, 0.3, 0.9),
                trend("community_agreement_rate", TrendDirection.DECREASING, -0.3, 0.9)), timeframe, END);

        assertEquals(2, alerts.size());
        assertEquals(AlertType.COMMUNITY_DISAGREEMENT, alerts.get(0).getType());
        assertEquals(AlertType.VOLUME_SPIKE, alerts.get(1).getType());
    }

    @Test
    void testNoAlertForFavourableDirection() {
        List<PredictiveAlert> alerts = predictor.predict(List.of(
                trend("content_volume", TrendDirection.DECREASING, -0.8, 0.9),
                trend("average_quality", TrendDirection.INCREASING, 0.8, 0.9)), timeframe, END);

        assertTrue(alerts.isEmpty());
    }

    @Test
    void testNoAlertBelowThresholds() {
        // 变化不足 25%
        assertTrue(predictor.predict(
                List.of(trend("content_volume", TrendDirection.INCREASING, 0.2, 0.9)), timeframe, END).isEmpty());
        // 置信度低于下限
        assertTrue(predictor.predict(
                List.of(trend("content_volume", TrendDirection.INCREASING, 0.9, 0.5)), timeframe, END).isEmpty());
        // 未绑定告警类型的指标
        assertTrue(predictor.predict(
                List.of(trend("total_actions", TrendDirection.INCREASING, 2.0, 1.0)), timeframe, END).isEmpty());
    }

    @Test
    void testConfidenceFloorFromProperties() {
        ModerationProperties properties = new ModerationProperties();
        properties.getAnalytics().setAlertConfidenceFloor(0.4);
        AlertPredictor relaxed = new AlertPredictor(properties);

        assertFalse(relaxed.predict(
                List.of(trend("content_volume", TrendDirection.INCREASING, 0.9, 0.5)), timeframe, END).isEmpty());
    }

    private static TrendPrediction trend(String metric, TrendDirection direction, double change, double confidence) {
        TrendPrediction trend = new TrendPrediction();
        trend.setMetric(metric);
        trend.setTrend(direction);
        trend.setChangeRate(change);
        trend.setConfidence(confidence);
        trend.setCurrentValue(1.0);
        trend.setPredictedValue(1.0);
        trend.setTimeframe("next day");
        return trend;
    }
}
