package com.community.moderation.entity;

import com.community.moderation.model.TrustTier;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * UserReputation Entity: 用户信誉，8 个行为因子 (0-100) 加权得到 overallScore (0-1000)。
 * 只由信誉引擎在处理结果和社区反馈时修改。
 */
@Entity
@Data
@Table(name = "userreputation")
public class UserReputation implements Serializable {

    @Id
    @Column(name = "user_id", length = 64)
    private String userId;

    // --- 八个加权因子 ---
    @Column(name = "content_quality", nullable = false)
    private double contentQuality;

    @Column(name = "community_helpfulness", nullable = false)
    private double communityHelpfulness;

    @Column(name = "consistent_activity", nullable = false)
    private double consistentActivity;

    @Column(name = "moderation_history", nullable = false)
    private double moderationHistory;

    @Column(name = "expertise", nullable = false)
    private double expertise;

    @Column(name = "community_trust", nullable = false)
    private double communityTrust;

    @Column(name = "account_maturity", nullable = false)
    private double accountMaturity;

    @Column(name = "behavior_pattern", nullable = false)
    private double behaviorPattern;

    @Column(name = "overall_score", nullable = false)
    private int overallScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "trust_tier", nullable = false, length = 20)
    private TrustTier trustTier;

    // 被处理（reject/ban）的次数
    @Column(name = "moderation_strikes", nullable = false)
    private int moderationStrikes;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_calculated", nullable = false)
    private LocalDateTime lastCalculated;

    @Version
    @Column(name = "version")
    private Long version;
}
