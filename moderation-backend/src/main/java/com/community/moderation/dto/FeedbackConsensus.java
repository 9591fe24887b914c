package com.community.moderation.dto;

import com.community.moderation.model.SeverityRating;
import lombok.Data;

/**
 * 某个队列项的社区共识（按等级加权，单个投票人权重不超过总权重的固定比例）
 */
@Data
public class FeedbackConsensus {

    public static final String UPHOLD = "uphold";
    public static final String REVIEW = "review";
    public static final String OVERTURN = "overturn";

    private Long queueItemId;

    private int totalVotes;

    private int accurateVotes;

    private double totalWeight;

    // 加权认同率：认为审核结果正确的权重占比
    private double agreementRate;

    private double tooStrictShare;

    private double accurateShare;

    private double tooLenientShare;

    private SeverityRating consensusRating;

    private String recommendation;
}
