package com.community.moderation.entity;

import com.community.moderation.model.ContentType;
import com.community.moderation.model.DecisionAction;
import com.community.moderation.model.Severity;
import com.community.moderation.model.TrustTier;
import com.community.moderation.util.StringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * ModerationDecision Entity: 一次自动审核的结果（只读）。
 * 重新评估同一内容会生成新记录，通过 contentId 关联。
 */
@Entity
@Data
@Table(name = "moderationdecision", indexes = {
        @Index(name = "idx_decision_content", columnList = "content_id"),
        @Index(name = "idx_decision_computed", columnList = "computed_at")
})
public class ModerationDecision implements Serializable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "decision_id")
    private Long decisionId;

    @Column(name = "evaluation_id", nullable = false, length = 36, unique = true)
    private String evaluationId;

    @Column(name = "content_id", nullable = false, length = 64)
    private String contentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", nullable = false, length = 20)
    private ContentType contentType;

    @Column(name = "author_id", nullable = false, length = 64)
    private String authorId;

    // 评估时作者的信誉快照
    @Enumerated(EnumType.STRING)
    @Column(name = "author_tier", length = 20)
    private TrustTier authorTier;

    @Column(name = "author_score")
    private Integer authorScore;

    // --- 原始信号 ---
    @Column(name = "spam_score")
    private double spamScore;

    @Column(name = "toxicity_score")
    private double toxicityScore;

    @Column(name = "quality_score")
    private double qualityScore;

    @Column(name = "cultural_adjustment")
    private double culturalAdjustment;

    // --- 文化语境衰减后的信号 ---
    @Column(name = "adjusted_spam")
    private double adjustedSpam;

    @Column(name = "adjusted_toxicity")
    private double adjustedToxicity;

    @Convert(converter = StringListConverter.class)
    @Column(name = "signal_flags", columnDefinition = "TEXT")
    private List<String> signalFlags = new ArrayList<>();

    @Column(name = "should_flag", nullable = false)
    private boolean shouldFlag;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 10)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 10)
    private DecisionAction action;

    @Column(name = "confidence")
    private double confidence;

    // 按优先级顺序记录所有命中的规则
    @Convert(converter = StringListConverter.class)
    @Column(name = "triggered_rule_ids", columnDefinition = "TEXT")
    private List<String> triggeredRuleIds = new ArrayList<>();

    @Column(name = "winning_rule_id", length = 64)
    private String winningRuleId;

    @Column(name = "degraded", nullable = false)
    private boolean degraded;

    @Column(name = "queue_item_id")
    private Long queueItemId;

    @Column(name = "queue_bypassed", nullable = false)
    private boolean queueBypassed;

    @Column(name = "processing_time_ms")
    private long processingTimeMs;

    @Column(name = "computed_at", nullable = false)
    private LocalDateTime computedAt;
}
