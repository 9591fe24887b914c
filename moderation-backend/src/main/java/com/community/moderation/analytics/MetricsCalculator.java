package com.community.moderation.analytics;

import com.community.moderation.dto.analytics.OverviewMetrics;
import com.community.moderation.entity.FeedbackVote;
import com.community.moderation.entity.ModerationAction;
import com.community.moderation.entity.ModerationDecision;
import com.community.moderation.entity.ModerationQueueItem;
import com.community.moderation.model.DecisionAction;
import com.community.moderation.model.SeverityRating;
import com.community.moderation.service.FeedbackAggregator;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 总体指标计算
 */
@Component
public class MetricsCalculator {

    private static final int SCALE = 4;

    private final FeedbackAggregator feedbackAggregator;

    public MetricsCalculator(FeedbackAggregator feedbackAggregator) {
        this.feedbackAggregator = feedbackAggregator;
    }

    public OverviewMetrics calculate(AnalyticsDataset dataset) {
        OverviewMetrics metrics = new OverviewMetrics();

        // --- 1. 审计记录与自动化率 ---
        long automated = 0;
        for (ModerationAction action : dataset.getActions()) {
            if (action.isAutomated()) {
                automated++;
            }
        }
        // 无需人工处理即结案的决定：allow、自动 block、高信誉作者免排队
        long autoResolved = 0;
        for (ModerationDecision decision : dataset.getDecisions()) {
            if (decision.getAction() == DecisionAction.ALLOW
                    || decision.getAction() == DecisionAction.BLOCK
                    || decision.isQueueBypassed()) {
                autoResolved++;
            }
        }
        long volume = dataset.getDecisions().size();
        metrics.setTotalActions(dataset.getActions().size());
        metrics.setAutomatedActions(automated);
        metrics.setContentVolumeProcessed(volume);
        metrics.setAutomationRate(ratio(autoResolved, volume));

        // --- 2. 评估耗时与内容质量 ---
        double totalTime = 0.0;
        double totalQuality = 0.0;
        for (ModerationDecision decision : dataset.getDecisions()) {
            totalTime += decision.getProcessingTimeMs();
            totalQuality += decision.getQualityScore();
        }
        metrics.setResponseTime(volume == 0 ? 0.0 : round(totalTime / volume));
        metrics.setAverageQualityScore(volume == 0 ? 0.0 : round(totalQuality / volume));

        // --- 3. 社区反馈：准确率、误判率、加权认同率 ---
        List<FeedbackVote> votes = dataset.getVotes();
        int accurate = 0;
        int falsePositive = 0;
        int falseNegative = 0;
        Map<Long, List<FeedbackVote>> votesByItem = new LinkedHashMap<>();
        for (FeedbackVote vote : votes) {
            if (vote.isWasAccurate()) {
                accurate++;
            } else if (vote.getSeverityRating() == SeverityRating.TOO_STRICT) {
                falsePositive++;
            } else if (vote.getSeverityRating() == SeverityRating.TOO_LENIENT) {
                falseNegative++;
            }
            votesByItem.computeIfAbsent(vote.getQueueItemId(), id -> new ArrayList<>()).add(vote);
        }
        metrics.setFeedbackVotes(votes.size());
        metrics.setAccuracyRate(ratio(accurate, votes.size()));
        metrics.setFalsePositiveRate(ratio(falsePositive, votes.size()));
        metrics.setFalseNegativeRate(ratio(falseNegative, votes.size()));

        double agreementSum = 0.0;
        for (Map.Entry<Long, List<FeedbackVote>> entry : votesByItem.entrySet()) {
            agreementSum += feedbackAggregator.aggregate(entry.getKey(), entry.getValue()).getAgreementRate();
        }
        metrics.setCommunityAgreementRate(votesByItem.isEmpty() ? 0.0 : round(agreementSum / votesByItem.size()));

        // --- 4. 队列处理时长 ---
        long totalMinutes = 0;
        int timed = 0;
        for (ModerationQueueItem item : dataset.getResolvedItems()) {
            if (item.getCreatedAt() != null && item.getProcessedAt() != null) {
                totalMinutes += Duration.between(item.getCreatedAt(), item.getProcessedAt()).toMinutes();
                timed++;
            }
        }
        metrics.setResolvedItems(dataset.getResolvedItems().size());
        metrics.setMeanResolutionMinutes(timed == 0 ? 0.0 : round((double) totalMinutes / timed));

        return metrics;
    }

    private double ratio(long numerator, long denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        return round((double) numerator / denominator);
    }

    private double round(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
