package com.community.moderation.service;

import com.community.moderation.config.ModerationProperties;
import com.community.moderation.dto.FeedbackConsensus;
import com.community.moderation.entity.FeedbackVote;
import com.community.moderation.model.SeverityRating;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 社区投票加权聚合。
 * 每票有效权重 = min(等级权重, c)，c 满足 c = maxVoterShare × 有效总权重，
 * 任一投票人占有效总权重的比例不超过 maxVoterShare。
 * 投票人数不足 1 / maxVoterShare 时上限无解，退化为等权（取原始权重均值）。
 */
@Component
public class FeedbackAggregator {

    private static final int SCALE = 4;
    private static final double EPSILON = 1e-9;

    private final ModerationProperties properties;

    public FeedbackAggregator(ModerationProperties properties) {
        this.properties = properties;
    }

    public FeedbackConsensus aggregate(Long queueItemId, List<FeedbackVote> votes) {
        FeedbackConsensus consensus = new FeedbackConsensus();
        consensus.setQueueItemId(queueItemId);
        consensus.setTotalVotes(votes.size());
        if (votes.isEmpty()) {
            consensus.setRecommendation(FeedbackConsensus.UPHOLD);
            return consensus;
        }

        double[] weights = effectiveWeights(votes);

        double totalWeight = 0.0;
        double accurateWeight = 0.0;
        int accurateVotes = 0;
        Map<SeverityRating, Double> ratingWeights = new EnumMap<>(SeverityRating.class);
        for (int i = 0; i < votes.size(); i++) {
            FeedbackVote vote = votes.get(i);
            double weight = weights[i];
            totalWeight += weight;
            if (vote.isWasAccurate()) {
                accurateWeight += weight;
                accurateVotes++;
            }
            ratingWeights.merge(vote.getSeverityRating(), weight, Double::sum);
        }

        consensus.setAccurateVotes(accurateVotes);
        consensus.setTotalWeight(round(totalWeight));
        if (totalWeight <= 0) {
            consensus.setRecommendation(FeedbackConsensus.UPHOLD);
            return consensus;
        }

        double agreement = accurateWeight / totalWeight;
        consensus.setAgreementRate(round(agreement));
        consensus.setTooStrictShare(round(ratingWeights.getOrDefault(SeverityRating.TOO_STRICT, 0.0) / totalWeight));
        consensus.setAccurateShare(round(ratingWeights.getOrDefault(SeverityRating.ACCURATE, 0.0) / totalWeight));
        consensus.setTooLenientShare(round(ratingWeights.getOrDefault(SeverityRating.TOO_LENIENT, 0.0) / totalWeight));

        // 权重并列时优先 accurate
        SeverityRating leading = SeverityRating.ACCURATE;
        double leadingWeight = ratingWeights.getOrDefault(SeverityRating.ACCURATE, 0.0);
        for (SeverityRating rating : new SeverityRating[]{SeverityRating.TOO_STRICT, SeverityRating.TOO_LENIENT}) {
            double weight = ratingWeights.getOrDefault(rating, 0.0);
            if (weight > leadingWeight) {
                leading = rating;
                leadingWeight = weight;
            }
        }
        consensus.setConsensusRating(leading);

        if (agreement < 0.3 && votes.size() >= properties.getFeedback().getMinVotesForConsensus()) {
            consensus.setRecommendation(FeedbackConsensus.OVERTURN);
        } else if (agreement < 0.6) {
            consensus.setRecommendation(FeedbackConsensus.REVIEW);
        } else {
            consensus.setRecommendation(FeedbackConsensus.UPHOLD);
        }
        return consensus;
    }

    /**
     * 加权多数方向：too_strict / too_lenient 权重过半时返回该方向，否则为空
     */
    public SeverityRating adjustmentDirection(FeedbackConsensus consensus) {
        if (consensus.getTooStrictShare() > 0.5) {
            return SeverityRating.TOO_STRICT;
        }
        if (consensus.getTooLenientShare() > 0.5) {
            return SeverityRating.TOO_LENIENT;
        }
        return null;
    }

    /**
     * 按投票顺序返回有效权重
     */
    double[] effectiveWeights(List<FeedbackVote> votes) {
        int n = votes.size();
        double[] raw = new double[n];
        double rawTotal = 0.0;
        for (int i = 0; i < n; i++) {
            raw[i] = Math.max(0.0, votes.get(i).getVoterReputationWeight());
            rawTotal += raw[i];
        }
        double share = properties.getFeedback().getMaxVoterShare();
        if (share >= 1.0 || n == 0) {
            return raw;
        }
        if (share <= 0.0 || n * share < 1.0 - EPSILON) {
            double[] equal = new double[n];
            Arrays.fill(equal, rawTotal / n);
            return equal;
        }

        // 从最大权重起逐个封顶：前 k 个取 c，其余保持原值，c = share × R / (1 - share × k)
        double[] sorted = raw.clone();
        Arrays.sort(sorted);
        double remaining = rawTotal;
        double cap = Double.NaN;
        for (int k = 0; k < n; k++) {
            double candidate = share * remaining / (1.0 - share * k);
            double largestUncapped = sorted[n - 1 - k];
            if (largestUncapped <= candidate + EPSILON) {
                cap = candidate;
                break;
            }
            remaining -= largestUncapped;
        }
        if (Double.isNaN(cap)) {
            double[] equal = new double[n];
            Arrays.fill(equal, rawTotal / n);
            return equal;
        }

        double[] capped = new double[n];
        for (int i = 0; i < n; i++) {
            capped[i] = Math.min(raw[i], cap);
        }
        return capped;
    }

    private double round(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
