package com.community.moderation.dto;

import com.community.moderation.entity.ModerationQueueItem;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueListing {

    // 严重程度降序，创建时间降序
    private List<ModerationQueueItem> items;

    private QueueStats stats;
}
