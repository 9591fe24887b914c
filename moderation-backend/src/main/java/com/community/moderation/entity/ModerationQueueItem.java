package com.community.moderation.entity;

import com.community.moderation.model.ContentType;
import com.community.moderation.model.QueueStatus;
import com.community.moderation.model.ResolutionAction;
import com.community.moderation.model.Severity;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * ModerationQueueItem Entity: 待人工处理的内容。
 * 同一 contentId 同一时刻最多只有一个未终结 (pending/reviewing) 的队列项。
 */
@Entity
@Data
@Table(name = "moderationqueue", indexes = {
        @Index(name = "idx_queue_content_status", columnList = "content_id, status"),
        @Index(name = "idx_queue_status_severity", columnList = "status, severity_rank")
})
public class ModerationQueueItem implements Serializable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "queue_item_id")
    private Long id;

    @Column(name = "content_id", nullable = false, length = 64)
    private String contentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", nullable = false, length = 20)
    private ContentType contentType;

    // 内容作者，举报入队且无历史决策时可能为空
    @Column(name = "author_id", length = 64)
    private String authorId;

    @Column(name = "reason", nullable = false, length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 10)
    private Severity severity;

    // 冗余存储 severity 的排序值，便于数据库侧排序
    @JsonIgnore
    @Column(name = "severity_rank", nullable = false)
    private int severityRank;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private QueueStatus status;

    @Column(name = "auto_flagged", nullable = false)
    private boolean autoFlagged;

    @Column(name = "flag_score")
    private double flagScore;

    @Column(name = "reported_by", length = 64)
    private String reportedBy;

    @Column(name = "assigned_moderator", length = 64)
    private String assignedModerator;

    @Column(name = "moderator_notes", length = 2000)
    private String moderatorNotes;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_taken", length = 10)
    private ResolutionAction actionTaken;

    // 触发入队的自动决策及其命中规则
    @Column(name = "decision_id")
    private Long decisionId;

    @Column(name = "rule_id", length = 64)
    private String ruleId;

    // 社区反馈是否已对该项关联规则调整过阈值
    @Column(name = "feedback_adjusted", nullable = false)
    private boolean feedbackAdjusted;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    @JsonIgnore
    @Version
    @Column(name = "version")
    private Long version;

    public void setSeverity(Severity severity) {
        this.severity = severity;
        this.severityRank = severity == null ? 0 : severity.getRank();
    }
}
