package com.community.moderation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * 信任等级。等级是 overallScore 的纯函数，分界点固定：
 * 0-49 restricted, 50-149 new, 150-299 trusted, 300-499 expert, 500-999 moderator, 1000+ admin
 */
public enum TrustTier {
    RESTRICTED("restricted", 0, 0.3, List.of("read_content")),
    NEW("new", 50, 0.8, List.of("read_content", "post_with_review", "basic_voting")),
    TRUSTED("trusted", 150, 1.5, List.of("read_content", "post_content", "report_content", "community_voting")),
    EXPERT("expert", 300, 2.5, List.of("read_content", "post_content", "report_content", "community_voting",
            "skip_routine_review", "expert_answers")),
    MODERATOR("moderator", 500, 3.0, List.of("read_content", "post_content", "report_content", "community_voting",
            "skip_routine_review", "moderate_queue", "review_reports")),
    ADMIN("admin", 1000, 3.0, List.of("all_privileges"));

    private final String code;
    private final int minScore;
    // 社区投票权重
    private final double voteWeight;
    private final List<String> privileges;

    TrustTier(String code, int minScore, double voteWeight, List<String> privileges) {
        this.code = code;
        this.minScore = minScore;
        this.voteWeight = voteWeight;
        this.privileges = privileges;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getMinScore() {
        return minScore;
    }

    public double getVoteWeight() {
        return voteWeight;
    }

    public List<String> getPrivileges() {
        return privileges;
    }

    /**
     * trusted 及以上等级的低严重度 flag 不进入人工队列
     */
    public boolean canBypassRoutineQueue() {
        return ordinal() >= TRUSTED.ordinal();
    }

    public static TrustTier fromScore(int overallScore) {
        TrustTier result = RESTRICTED;
        for (TrustTier tier : values()) {
            if (overallScore >= tier.minScore) {
                result = tier;
            }
        }
        return result;
    }

    public static TrustTier fromCode(String code) {
        for (TrustTier tier : values()) {
            if (tier.code.equalsIgnoreCase(code)) {
                return tier;
            }
        }
        return null;
    }
}
