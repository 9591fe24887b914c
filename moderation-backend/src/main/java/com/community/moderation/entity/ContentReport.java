package com.community.moderation.entity;

import com.community.moderation.model.ContentType;
import com.community.moderation.model.ReportCategory;
import com.community.moderation.model.ReportPriority;
import com.community.moderation.model.ReportStatus;
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
 * ContentReport Entity: 用户发起的举报
 */
@Entity
@Data
@Table(name = "contentreport", indexes = {
        @Index(name = "idx_report_content_reporter", columnList = "content_id, reporter_id"),
        @Index(name = "idx_report_queue_item", columnList = "queue_item_id")
})
public class ContentReport implements Serializable {

    public static final String RESOLUTION_DISMISSED = "dismissed";
    public static final String RESOLUTION_UPHELD_PREFIX = "upheld:";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "report_id")
    private Long id;

    @Column(name = "content_id", nullable = false, length = 64)
    private String contentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", nullable = false, length = 20)
    private ContentType contentType;

    @Column(name = "reporter_id", nullable = false, length = 64)
    private String reporterId;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private ReportCategory category;

    @Column(name = "reason", nullable = false, length = 500)
    private String reason;

    @Column(name = "description", length = 2000)
    private String description;

    @Convert(converter = StringListConverter.class)
    @Column(name = "evidence_urls", columnDefinition = "TEXT")
    private List<String> evidenceUrls = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 10)
    private ReportPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private ReportStatus status;

    @Column(name = "queue_item_id")
    private Long queueItemId;

    @Column(name = "resolved_by", length = 64)
    private String resolvedBy;

    @Column(name = "resolution", length = 500)
    private String resolution;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
