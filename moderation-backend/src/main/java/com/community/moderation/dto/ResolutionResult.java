package com.community.moderation.dto;

import com.community.moderation.entity.ModerationAction;
import com.community.moderation.entity.ModerationQueueItem;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionResult {

    private ModerationQueueItem item;

    private ModerationAction action;

    // 本次处理同时结案的举报数
    private int reportsResolved;
}
