package com.community.moderation.entity;

import com.community.moderation.model.SeverityRating;
import com.community.moderation.model.TrustTier;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * FeedbackVote Entity: 社区对已处理队列项的评价，每个 (queueItemId, voterId) 仅一条
 */
@Entity
@Data
@Table(name = "feedbackvote", uniqueConstraints = {
        @UniqueConstraint(name = "uk_vote_item_voter", columnNames = {"queue_item_id", "voter_id"})
})
public class FeedbackVote implements Serializable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "vote_id")
    private Long id;

    @Column(name = "queue_item_id", nullable = false)
    private Long queueItemId;

    @Column(name = "content_id", nullable = false, length = 64)
    private String contentId;

    @Column(name = "voter_id", nullable = false, length = 64)
    private String voterId;

    @Column(name = "was_accurate", nullable = false)
    private boolean wasAccurate;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity_rating", nullable = false, length = 12)
    private SeverityRating severityRating;

    @Enumerated(EnumType.STRING)
    @Column(name = "voter_tier", nullable = false, length = 20)
    private TrustTier voterTier;

    // 投票时按等级得到的原始权重，上限截断在聚合时计算
    @Column(name = "voter_weight", nullable = false)
    private double voterReputationWeight;

    @Column(name = "submitted_at", nullable = false)
    private LocalDateTime submittedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
