package com.community.moderation.analytics;

import com.community.moderation.dto.analytics.ContentInsight;
import com.community.moderation.dto.analytics.OverviewMetrics;
import com.community.moderation.dto.analytics.PerformanceOptimization;
import com.community.moderation.dto.analytics.TrendPrediction;
import com.community.moderation.dto.analytics.UserBehaviorPattern;
import com.community.moderation.model.ImplementationCost;
import com.community.moderation.model.RiskLevel;
import com.community.moderation.model.TrendDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OptimizationAdvisorTest {

    private OptimizationAdvisor advisor;

    @BeforeEach
    void setUp() {
        advisor = new OptimizationAdvisor();
    }

    @Test
    void testPriorityFormula() {
        assertEquals(4, OptimizationAdvisor.priority(70, 25, ImplementationCost.MEDIUM));
        // 上限 10，下限 1
        assertEquals(10, OptimizationAdvisor.priority(0, 100, ImplementationCost.LOW));
        assertEquals(1, OptimizationAdvisor.priority(99, 1, ImplementationCost.HIGH));
    }

    @Test
    void testNoOptimizationsWithoutData() {
        assertTrue(advisor.optimizations(new OverviewMetrics()).isEmpty());
    }

    // 只有处理量时仅评估自动化覆盖
    @Test
    void testAutomationCoverageOnly() {
        OverviewMetrics overview = new OverviewMetrics();
        overview.setContentVolumeProcessed(40);
        overview.setAutomationRate(0.5);

        List<PerformanceOptimization> result = advisor.optimizations(overview);

        assertEquals(1, result.size());
        PerformanceOptimization optimization = result.get(0);
        assertEquals("Automation Coverage", optimization.getArea());
        assertEquals(50.0, optimization.getCurrentEfficiency(), 1e-9);
        assertEquals(30.0, optimization.getPotentialImprovement(), 1e-9);
        assertEquals(6, optimization.getPriority());
        assertEquals(ImplementationCost.MEDIUM, optimization.getImplementationCost());
    }

    // 已达目标的领域不输出
    @Test
    void testAreasAtTargetSkipped() {
        OverviewMetrics overview = new OverviewMetrics();
        overview.setContentVolumeProcessed(40);
        overview.setAutomationRate(0.9);
        overview.setFeedbackVotes(10);
        overview.setAccuracyRate(0.97);
        overview.setFalsePositiveRate(0.01);

        assertTrue(advisor.optimizations(overview).isEmpty());
    }

    @Test
    void testOptimizationsSortedByPriority() {
        OverviewMetrics overview = new OverviewMetrics();
        overview.setContentVolumeProcessed(100);
        overview.setAutomationRate(0.7);
        overview.setFeedbackVotes(4);
        overview.setAccuracyRate(0.5);
        overview.setFalsePositiveRate(0.3);
        overview.setResolvedItems(4);
        overview.setMeanResolutionMinutes(120);

        List<PerformanceOptimization> result = advisor.optimizations(overview);

        assertEquals(5, result.size());
        for (int i = 1; i < result.size(); i++) {
            assertTrue(result.get(i - 1).getPriority() >= result.get(i).getPriority());
        }
    }

    @Test
    void testRecommendationsCapped() {
        OverviewMetrics overview = new OverviewMetrics();
        overview.setFeedbackVotes(10);
        overview.setAccuracyRate(0.5);
        overview.setFalsePositiveRate(0.4);
        overview.setCommunityAgreementRate(0.3);
        overview.setResponseTime(2500);
        overview.setContentVolumeProcessed(100);
        overview.setAutomationRate(0.2);

        TrendPrediction fpTrend = new TrendPrediction();
        fpTrend.setMetric("false_positive_rate");
        fpTrend.setTrend(TrendDirection.INCREASING);
        ContentInsight insight = new ContentInsight();
        insight.setImpact(ContentInsight.IMPACT_NEGATIVE);
        insight.setFrequency(45);
        UserBehaviorPattern pattern = new UserBehaviorPattern();
        pattern.setRiskLevel(RiskLevel.HIGH);

        List<String> recommendations = advisor.recommendations(overview, List.of(fpTrend), List.of(insight),
                List.of(pattern));

        assertEquals(OptimizationAdvisor.MAX_RECOMMENDATIONS, recommendations.size());
        assertTrue(recommendations.get(0).startsWith("Improve model accuracy"));
    }

    @Test
    void testHealthyWindowHasNoRecommendations() {
        OverviewMetrics overview = new OverviewMetrics();
        overview.setFeedbackVotes(10);
        overview.setAccuracyRate(0.9);
        overview.setFalsePositiveRate(0.05);
        overview.setCommunityAgreementRate(0.85);
        overview.setResponseTime(40);
        overview.setContentVolumeProcessed(100);
        overview.setAutomationRate(0.8);

        assertTrue(advisor.recommendations(overview, Collections.<TrendPrediction>emptyList(),
                Collections.<ContentInsight>emptyList(), Collections.<UserBehaviorPattern>emptyList()).isEmpty());
    }
}
