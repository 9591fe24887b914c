package com.community.moderation.analytics;

import com.community.moderation.dto.analytics.ContentInsight;
import com.community.moderation.dto.analytics.OverviewMetrics;
import com.community.moderation.dto.analytics.PerformanceOptimization;
import com.community.moderation.dto.analytics.TrendPrediction;
import com.community.moderation.dto.analytics.UserBehaviorPattern;
import com.community.moderation.model.ImplementationCost;
import com.community.moderation.model.RiskLevel;
import com.community.moderation.model.TrendDirection;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 优化建议与运营建议。输出只依赖输入指标，相同输入得到相同结果。
 */
@Component
public class OptimizationAdvisor {

    static final int MAX_RECOMMENDATIONS = 8;
    // 队列处理时长目标（分钟）
    static final double QUEUE_SLA_MINUTES = 60.0;
    // 每个已处理队列项期望的投票数
    static final double TARGET_VOTES_PER_ITEM = 3.0;
    private static final double PRIORITY_DIVISOR = 5.0;

    public List<PerformanceOptimization> optimizations(OverviewMetrics overview) {
        List<PerformanceOptimization> result = new ArrayList<>();

        if (overview.getFeedbackVotes() > 0) {
            addIfImprovable(result, "Automated Decision Accuracy", overview.getAccuracyRate() * 100, 95,
                    ImplementationCost.MEDIUM,
                    "Improve automated decision accuracy using community feedback",
                    List.of("Review rules with the most inaccurate votes",
                            "Tune signal scorer keyword lists",
                            "Re-check cultural calibration for bilingual content"));
            addIfImprovable(result, "False Positive Reduction", (1 - overview.getFalsePositiveRate()) * 100, 98,
                    ImplementationCost.MEDIUM,
                    "Reduce false positives through reputation weighting and context signals",
                    List.of("Raise thresholds of rules rated too strict",
                            "Add professional-context exemptions",
                            "Use content-type specific thresholds"));
        }
        if (overview.getResolvedItems() > 0) {
            double speed = Math.min(1.0, QUEUE_SLA_MINUTES / Math.max(overview.getMeanResolutionMinutes(), QUEUE_SLA_MINUTES));
            addIfImprovable(result, "Queue Processing Speed", speed * 100, 100,
                    ImplementationCost.LOW,
                    "Shorten time from enqueue to resolution",
                    List.of("Claim critical items first",
                            "Let trusted authors bypass routine review",
                            "Add moderator coverage during peak hours"));
            double votesPerItem = (double) overview.getFeedbackVotes() / overview.getResolvedItems();
            addIfImprovable(result, "Community Engagement", Math.min(1.0, votesPerItem / TARGET_VOTES_PER_ITEM) * 100, 80,
                    ImplementationCost.HIGH,
                    "Increase community participation in reviewing moderation outcomes",
                    List.of("Reward accurate feedback votes",
                            "Surface recently resolved items to trusted users",
                            "Publish monthly moderation summaries"));
        }
        if (overview.getContentVolumeProcessed() > 0) {
            addIfImprovable(result, "Automation Coverage", overview.getAutomationRate() * 100, 80,
                    ImplementationCost.MEDIUM,
                    "Settle more low-risk content without human review",
                    List.of("Expand rules for clearly benign content",
                            "Review queue reasons that are resolved as approve",
                            "Extend queue bypass to more trusted authors"));
        }

        result.sort(Comparator.comparingInt(PerformanceOptimization::getPriority).reversed()
                .thenComparing(Comparator.comparingDouble(PerformanceOptimization::getPotentialImprovement).reversed())
                .thenComparing(PerformanceOptimization::getArea));
        return result;
    }

    /**
     * priority = clamp(round(potential × (2 - current/100) / costFactor / 5), 1, 10)
     */
    static int priority(double currentEfficiency, double potentialImprovement, ImplementationCost cost) {
        double score = potentialImprovement * (2 - currentEfficiency / 100) / cost.getCostFactor() / PRIORITY_DIVISOR;
        long rounded = Math.round(score);
        return (int) Math.max(1, Math.min(10, rounded));
    }

    private void addIfImprovable(List<PerformanceOptimization> result, String area, double current, double target,
                                 ImplementationCost cost, String description, List<String> steps) {
        double currentEfficiency = round(current);
        double potential = round(target - currentEfficiency);
        if (potential <= 0) {
            return;
        }
        PerformanceOptimization optimization = new PerformanceOptimization();
        optimization.setArea(area);
        optimization.setCurrentEfficiency(currentEfficiency);
        optimization.setPotentialImprovement(potential);
        optimization.setImplementationCost(cost);
        optimization.setPriority(priority(currentEfficiency, potential, cost));
        optimization.setDescription(description);
        optimization.setSteps(new ArrayList<>(steps));
        result.add(optimization);
    }

    public List<String> recommendations(OverviewMetrics overview, List<TrendPrediction> trends,
                                        List<ContentInsight> insights, List<UserBehaviorPattern> patterns) {
        List<String> recommendations = new ArrayList<>();

        if (overview.getFeedbackVotes() > 0) {
            if (overview.getAccuracyRate() < 0.8) {
                recommendations.add("Improve model accuracy: current rate is below 80%");
            }
            if (overview.getFalsePositiveRate() > 0.2) {
                recommendations.add("High false positive rate detected: consider adjusting threshold sensitivity");
            }
            if (overview.getCommunityAgreementRate() < 0.7) {
                recommendations.add("Low community agreement: review recent decisions and gather more feedback");
            }
        }
        if (overview.getResponseTime() > 1000) {
            recommendations.add("Response times are high: optimize the scoring pipeline and system resources");
        }

        boolean negativeTrend = false;
        for (TrendPrediction trend : trends) {
            boolean watched = TrackedMetric.FALSE_POSITIVE_RATE.getCode().equals(trend.getMetric())
                    || TrackedMetric.RESPONSE_TIME.getCode().equals(trend.getMetric());
            if (watched && trend.getTrend() == TrendDirection.INCREASING) {
                negativeTrend = true;
            }
        }
        if (negativeTrend) {
            recommendations.add("Negative trends detected: apply preventive measures before issues escalate");
        }

        for (ContentInsight insight : insights) {
            if (ContentInsight.IMPACT_NEGATIVE.equals(insight.getImpact()) && insight.getFrequency() > 30) {
                recommendations.add("High-frequency negative content patterns identified: prioritize rule updates");
                break;
            }
        }
        for (UserBehaviorPattern pattern : patterns) {
            if (pattern.getRiskLevel() == RiskLevel.HIGH) {
                recommendations.add("High-risk user behavior patterns detected: apply targeted interventions");
                break;
            }
        }
        if (overview.getContentVolumeProcessed() > 0 && overview.getAutomationRate() < 0.6) {
            recommendations.add("Automation rate is below target: consider expanding automated decision criteria");
        }

        return recommendations.size() > MAX_RECOMMENDATIONS
                ? new ArrayList<>(recommendations.subList(0, MAX_RECOMMENDATIONS))
                : recommendations;
    }

    private double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
