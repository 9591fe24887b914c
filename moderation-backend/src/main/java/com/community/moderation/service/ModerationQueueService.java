package com.community.moderation.service;

import com.community.moderation.dto.EnqueueCommand;
import com.community.moderation.dto.QueueFilter;
import com.community.moderation.dto.QueueListing;
import com.community.moderation.dto.ResolutionResult;
import com.community.moderation.entity.ModerationQueueItem;
import com.community.moderation.model.ResolutionAction;

/**
 * 人工审核队列。同一 contentId 的写操作串行执行。
 */
public interface ModerationQueueService {

    /**
     * 新建队列项；该内容已有未终结队列项时抛出 DuplicateActiveException
     */
    ModerationQueueItem enqueue(EnqueueCommand command);

    /**
     * 新建队列项，或复用已有的未终结队列项（必要时提升其严重程度）
     */
    ModerationQueueItem enqueueOrAttach(EnqueueCommand command);

    QueueListing list(QueueFilter filter, Integer limit);

    ModerationQueueItem getItem(Long queueItemId);

    /**
     * pending -> reviewing，并指派审核员
     */
    ModerationQueueItem claim(Long queueItemId, String moderatorId);

    /**
     * 处理队列项：写审计记录，并在同一事务内更新作者与举报人的信誉
     */
    ResolutionResult resolve(Long queueItemId, String moderatorId, ResolutionAction action, String notes);
}
