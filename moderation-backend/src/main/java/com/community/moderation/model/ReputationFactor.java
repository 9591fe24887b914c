package com.community.moderation.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 信誉的八个加权因子，权重合计 1.0
 */
public enum ReputationFactor {
    CONTENT_QUALITY("contentQuality", "0.20"),
    COMMUNITY_HELPFULNESS("communityHelpfulness", "0.18"),
    CONSISTENT_ACTIVITY("consistentActivity", "0.15"),
    MODERATION_HISTORY("moderationHistory", "0.15"),
    EXPERTISE("expertise", "0.12"),
    COMMUNITY_TRUST("communityTrust", "0.10"),
    ACCOUNT_MATURITY("accountMaturity", "0.05"),
    BEHAVIOR_PATTERN("behaviorPattern", "0.05");

    private final String code;
    private final String weight;

    ReputationFactor(String code, String weight) {
        this.code = code;
        this.weight = weight;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getWeight() {
        return weight;
    }
}
