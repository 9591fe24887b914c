package com.community.moderation.dto;

import com.community.moderation.model.ContentType;
import com.community.moderation.model.QueueStatus;
import com.community.moderation.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 队列筛选条件，字段为 null 时不过滤
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueFilter {

    private QueueStatus status;

    private Severity severity;

    private ContentType contentType;
}
