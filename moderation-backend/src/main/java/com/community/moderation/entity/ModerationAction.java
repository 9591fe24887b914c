package com.community.moderation.entity;

import com.community.moderation.model.ContentType;
import jakarta.persistence.Column;
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

/**
 * ModerationAction Entity: 审核动作审计记录（只追加）。
 * 人工处理队列项和自动 block 都会写入一条。
 */
@Entity
@Data
@Table(name = "moderationaction", indexes = {
        @Index(name = "idx_action_created", columnList = "created_at")
})
public class ModerationAction implements Serializable {

    public static final String SYSTEM_MODERATOR = "system";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "action_id")
    private Long id;

    @Column(name = "queue_item_id")
    private Long queueItemId;

    @Column(name = "content_id", nullable = false, length = 64)
    private String contentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", nullable = false, length = 20)
    private ContentType contentType;

    // approve/reject/edit/warn/ban 或自动的 block
    @Column(name = "action_type", nullable = false, length = 10)
    private String actionType;

    @Column(name = "moderator_id", nullable = false, length = 64)
    private String moderatorId;

    @Column(name = "reason", length = 2000)
    private String reason;

    @Column(name = "is_automated", nullable = false)
    private boolean automated;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
