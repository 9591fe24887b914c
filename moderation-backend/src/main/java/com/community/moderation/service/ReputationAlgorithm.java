package com.community.moderation.service;

import com.community.moderation.entity.UserReputation;
import com.community.moderation.model.ReputationDelta;
import com.community.moderation.model.ReputationFactor;
import com.community.moderation.model.ResolutionAction;
import com.community.moderation.model.Severity;
import com.community.moderation.model.TrustTier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * 信誉算法组件：严格按固定权重计算总分，所有计算使用 BigDecimal。
 *
 * 【总分】Score = Σ(factor_i × weight_i) × 10，范围 [0, 1000]
 * 【等级】Tier = f(Score)，固定分界点的单调阶梯函数
 * 【增量】每个事件只对少数因子做加减，O(1)
 */
@Component
public class ReputationAlgorithm {

    // --- 因子与总分的范围 ---
    private static final BigDecimal FACTOR_MIN = BigDecimal.ZERO;
    private static final BigDecimal FACTOR_MAX = new BigDecimal("100");
    private static final BigDecimal SCORE_SCALE = BigDecimal.TEN;
    private static final int SCORE_MAX = 1000;

    // 新用户各因子的基线值，对应总分 100 (new)
    private static final double BASELINE_FACTOR = 10.0;

    private static final int SCALE = 4;
    private static final RoundingMode MODE = RoundingMode.HALF_UP;

    /**
     * 1. 计算总分：Σ(factor_i × weight_i) × 10，截断到 [0, 1000]
     */
    public int calculateOverallScore(UserReputation reputation) {
        BigDecimal weighted = BigDecimal.ZERO;
        for (ReputationFactor factor : ReputationFactor.values()) {
            BigDecimal value = clampFactor(BigDecimal.valueOf(getFactor(reputation, factor)));
            weighted = weighted.add(value.multiply(new BigDecimal(factor.getWeight())));
        }
        int score = weighted.multiply(SCORE_SCALE).setScale(0, MODE).intValue();
        return Math.max(0, Math.min(SCORE_MAX, score));
    }

    /**
     * 2. 等级映射
     */
    public TrustTier determineTrustTier(int overallScore) {
        return TrustTier.fromScore(overallScore);
    }

    /**
     * 3. 新用户基线
     */
    public UserReputation newBaseline(String userId, LocalDateTime now) {
        UserReputation reputation = new UserReputation();
        reputation.setUserId(userId);
        for (ReputationFactor factor : ReputationFactor.values()) {
            setFactor(reputation, factor, BASELINE_FACTOR);
        }
        reputation.setOverallScore(calculateOverallScore(reputation));
        reputation.setTrustTier(determineTrustTier(reputation.getOverallScore()));
        reputation.setCreatedAt(now);
        reputation.setLastCalculated(now);
        return reputation;
    }

    /**
     * 4. 应用增量并重算总分与等级
     */
    public void apply(UserReputation reputation, ReputationDelta delta, LocalDateTime now) {
        for (ReputationFactor factor : ReputationFactor.values()) {
            double change = delta.get(factor);
            if (change == 0.0) {
                continue;
            }
            BigDecimal updated = clampFactor(BigDecimal.valueOf(getFactor(reputation, factor))
                    .add(BigDecimal.valueOf(change)));
            setFactor(reputation, factor, updated.setScale(SCALE, MODE).doubleValue());
        }
        if (delta.isStrike()) {
            reputation.setModerationStrikes(reputation.getModerationStrikes() + 1);
        }
        reputation.setOverallScore(calculateOverallScore(reputation));
        reputation.setTrustTier(determineTrustTier(reputation.getOverallScore()));
        reputation.setLastCalculated(now);
    }

    /**
     * 5. 队列处理结果对作者的影响，按严重程度倍率缩放扣分：
     * approve: 审核记录 +2, 行为模式 +1
     * edit:    -1 / -1
     * warn:    -2 / -2
     * reject:  -3 / -2
     * ban:     -6 / -4
     */
    public ReputationDelta resolutionDelta(ResolutionAction action, Severity severity) {
        double multiplier = severity == null ? 1.0 : severity.getReputationMultiplier();
        ReputationDelta delta = new ReputationDelta("resolution:" + action.getCode());
        switch (action) {
            case APPROVE:
                delta.add(ReputationFactor.MODERATION_HISTORY, 2.0)
                        .add(ReputationFactor.BEHAVIOR_PATTERN, 1.0);
                break;
            case EDIT:
                delta.add(ReputationFactor.MODERATION_HISTORY, -1.0 * multiplier)
                        .add(ReputationFactor.BEHAVIOR_PATTERN, -1.0 * multiplier);
                break;
            case WARN:
                delta.add(ReputationFactor.MODERATION_HISTORY, -2.0 * multiplier)
                        .add(ReputationFactor.BEHAVIOR_PATTERN, -2.0 * multiplier);
                break;
            case REJECT:
                delta.add(ReputationFactor.MODERATION_HISTORY, -3.0 * multiplier)
                        .add(ReputationFactor.BEHAVIOR_PATTERN, -2.0 * multiplier);
                delta.setStrike(true);
                break;
            case BAN:
                delta.add(ReputationFactor.MODERATION_HISTORY, -6.0 * multiplier)
                        .add(ReputationFactor.BEHAVIOR_PATTERN, -4.0 * multiplier);
                delta.setStrike(true);
                break;
            default:
                break;
        }
        return delta;
    }

    /**
     * 6. 举报被采纳时对举报人的奖励
     */
    public ReputationDelta reporterReward() {
        return new ReputationDelta("report_upheld").add(ReputationFactor.COMMUNITY_TRUST, 1.0);
    }

    /**
     * 7. 社区投票与最终处理一致时对投票人的奖励
     */
    public ReputationDelta accurateVoteReward() {
        return new ReputationDelta("accurate_vote").add(ReputationFactor.COMMUNITY_TRUST, 1.0);
    }

    public double getFactor(UserReputation reputation, ReputationFactor factor) {
        switch (factor) {
            case CONTENT_QUALITY:
                return reputation.getContentQuality();
            case COMMUNITY_HELPFULNESS:
                return reputation.getCommunityHelpfulness();
            case CONSISTENT_ACTIVITY:
                return reputation.getConsistentActivity();
            case MODERATION_HISTORY:
                return reputation.getModerationHistory();
            case EXPERTISE:
                return reputation.getExpertise();
            case COMMUNITY_TRUST:
                return reputation.getCommunityTrust();
            case ACCOUNT_MATURITY:
                return reputation.getAccountMaturity();
            case BEHAVIOR_PATTERN:
                return reputation.getBehaviorPattern();
            default:
                throw new IllegalArgumentException("Unknown factor " + factor);
        }
    }

    private void setFactor(UserReputation reputation, ReputationFactor factor, double value) {
        switch (factor) {
            case CONTENT_QUALITY:
                reputation.setContentQuality(value);
                break;
            case COMMUNITY_HELPFULNESS:
                reputation.setCommunityHelpfulness(value);
                break;
            case CONSISTENT_ACTIVITY:
                reputation.setConsistentActivity(value);
                break;
            case MODERATION_HISTORY:
                reputation.setModerationHistory(value);
                break;
            case EXPERTISE:
                reputation.setExpertise(value);
                break;
            case COMMUNITY_TRUST:
                reputation.setCommunityTrust(value);
                break;
            case ACCOUNT_MATURITY:
                reputation.setAccountMaturity(value);
                break;
            case BEHAVIOR_PATTERN:
                reputation.setBehaviorPattern(value);
                break;
            default:
                throw new IllegalArgumentException("Unknown factor " + factor);
        }
    }

    private BigDecimal clampFactor(BigDecimal value) {
        if (value.compareTo(FACTOR_MIN) < 0) {
            return FACTOR_MIN;
        }
        if (value.compareTo(FACTOR_MAX) > 0) {
            return FACTOR_MAX;
        }
        return value;
    }
}
