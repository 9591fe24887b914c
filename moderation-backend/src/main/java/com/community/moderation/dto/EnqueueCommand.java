package com.community.moderation.dto;

import com.community.moderation.model.ContentType;
import com.community.moderation.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 入队参数
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EnqueueCommand {

    private String contentId;

    private ContentType contentType;

    private String authorId;

    private String reason;

    private Severity severity;

    private boolean autoFlagged;

    private double flagScore;

    // 举报入队时的举报人
    private String reporterId;

    private Long decisionId;

    private String ruleId;
}
