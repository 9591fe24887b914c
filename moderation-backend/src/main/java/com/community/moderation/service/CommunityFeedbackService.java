package com.community.moderation.service;

import com.community.moderation.dto.FeedbackConsensus;
import com.community.moderation.dto.FeedbackSubmission;
import com.community.moderation.model.SeverityRating;

public interface CommunityFeedbackService {

    /**
     * 对已处理的队列项投票。每个 (queueItemId, voterId) 仅保留一票，重复提交覆盖旧票。
     */
    FeedbackSubmission submitVote(Long queueItemId, String voterId, boolean wasAccurate, SeverityRating severityRating);

    FeedbackConsensus getConsensus(Long queueItemId);
}
