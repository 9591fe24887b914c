package com.community.moderation.dto;

import com.community.moderation.entity.FeedbackVote;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackSubmission {

    private FeedbackVote vote;

    // 是否覆盖了该用户之前的投票
    private boolean overwritten;

    private FeedbackConsensus consensus;

    // 本次投票触发阈值调整时的规则与新阈值
    private String adjustedRuleId;

    private Double adjustedThreshold;
}
