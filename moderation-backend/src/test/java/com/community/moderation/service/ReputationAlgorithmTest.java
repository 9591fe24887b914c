package com.community.moderation.service;

import com.community.moderation.entity.UserReputation;
import com.community.moderation.model.ReputationDelta;
import com.community.moderation.model.ReputationFactor;
import com.community.moderation.model.ResolutionAction;
import com.community.moderation.model.Severity;
import com.community.moderation.model.TrustTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReputationAlgorithmTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 1, 12, 0);

    private ReputationAlgorithm algorithm;

    @BeforeEach
    void setUp() {
        algorithm = new ReputationAlgorithm();
    }

    // 新用户基线：各因子 10 分，总分 100，等级 new
    @Test
    void testNewBaseline() {
        UserReputation reputation = algorithm.newBaseline("u1", NOW);

        assertEquals(100, reputation.getOverallScore());
        assertEquals(TrustTier.NEW, reputation.getTrustTier());
        assertEquals(10.0, reputation.getModerationHistory());
        assertEquals(NOW, reputation.getCreatedAt());
    }

    @Test
    void testCalculateOverallScore_Bounds() {
        UserReputation max = reputationWithAllFactors(100.0);
        UserReputation min = reputationWithAllFactors(0.0);

        assertEquals(1000, algorithm.calculateOverallScore(max));
        assertEquals(0, algorithm.calculateOverallScore(min));
    }

    // 超出 [0, 100] 的因子值按边界计算
    @Test
    void testCalculateOverallScore_ClampsFactors() {
        UserReputation reputation = reputationWithAllFactors(250.0);

        assertEquals(1000, algorithm.calculateOverallScore(reputation));
    }

    // 等级是总分的单调阶梯函数
    @Test
    void testTrustTierBreakpoints() {
        assertEquals(TrustTier.RESTRICTED, algorithm.determineTrustTier(0));
        assertEquals(TrustTier.RESTRICTED, algorithm.determineTrustTier(49));
        assertEquals(TrustTier.NEW, algorithm.determineTrustTier(50));
        assertEquals(TrustTier.NEW, algorithm.determineTrustTier(149));
        assertEquals(TrustTier.TRUSTED, algorithm.determineTrustTier(150));
        assertEquals(TrustTier.TRUSTED, algorithm.determineTrustTier(299));
        assertEquals(TrustTier.EXPERT, algorithm.determineTrustTier(300));
        assertEquals(TrustTier.EXPERT, algorithm.determineTrustTier(499));
        assertEquals(TrustTier.MODERATOR, algorithm.determineTrustTier(500));
        assertEquals(TrustTier.MODERATOR, algorithm.determineTrustTier(999));
        assertEquals(TrustTier.ADMIN, algorithm.determineTrustTier(1000));

        TrustTier previous = TrustTier.RESTRICTED;
        for (int score = 0; score <= 1000; score++) {
            TrustTier tier = algorithm.determineTrustTier(score);
            assertTrue(tier.ordinal() >= previous.ordinal(), "tier decreased at score " + score);
            previous = tier;
        }
    }

    // reject(high)：审核记录 -6，行为模式 -4，记一次处罚
    @Test
    void testApplyRejectDelta() {
        UserReputation reputation = algorithm.newBaseline("u1", NOW);

        algorithm.apply(reputation, algorithm.resolutionDelta(ResolutionAction.REJECT, Severity.HIGH), NOW.plusHours(1));

        assertEquals(4.0, reputation.getModerationHistory());
        assertEquals(6.0, reputation.getBehaviorPattern());
        assertEquals(1, reputation.getModerationStrikes());
        // 8.0 + 4 × 0.15 + 6 × 0.05 = 8.9 -> 89
        assertEquals(89, reputation.getOverallScore());
        assertEquals(TrustTier.NEW, reputation.getTrustTier());
        assertEquals(NOW.plusHours(1), reputation.getLastCalculated());
    }

    @Test
    void testApplyApproveDelta_NotScaledBySeverity() {
        ReputationDelta delta = algorithm.resolutionDelta(ResolutionAction.APPROVE, Severity.CRITICAL);

        assertEquals(2.0, delta.get(ReputationFactor.MODERATION_HISTORY));
        assertEquals(1.0, delta.get(ReputationFactor.BEHAVIOR_PATTERN));
        assertFalse(delta.isStrike());
    }

    @Test
    void testApplyBanDelta_ClampsAtZero() {
        UserReputation reputation = algorithm.newBaseline("u1", NOW);

        algorithm.apply(reputation, algorithm.resolutionDelta(ResolutionAction.BAN, Severity.CRITICAL), NOW);

        // -18 / -12 截断到 0
        assertEquals(0.0, reputation.getModerationHistory());
        assertEquals(0.0, reputation.getBehaviorPattern());
        assertEquals(80, reputation.getOverallScore());
    }

    @Test
    void testAccurateVoteReward() {
        UserReputation reputation = algorithm.newBaseline("u1", NOW);

        algorithm.apply(reputation, algorithm.accurateVoteReward(), NOW);

        assertEquals(11.0, reputation.getCommunityTrust());
        assertEquals(101, reputation.getOverallScore());
    }

    private UserReputation reputationWithAllFactors(double value) {
        UserReputation reputation = new UserReputation();
        reputation.setUserId("u");
        reputation.setContentQuality(value);
        reputation.setCommunityHelpfulness(value);
        reputation.setConsistentActivity(value);
        reputation.setModerationHistory(value);
        reputation.setExpertise(value);
        reputation.setCommunityTrust(value);
        reputation.setAccountMaturity(value);
        reputation.setBehaviorPattern(value);
        return reputation;
    }
}
