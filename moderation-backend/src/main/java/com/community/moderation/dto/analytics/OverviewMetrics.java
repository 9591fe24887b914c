package com.community.moderation.dto.analytics;

import lombok.Data;

/**
 * 窗口内的总体指标
 */
@Data
public class OverviewMetrics {

    // 审计记录总数（人工 + 自动）
    private long totalActions;

    private long automatedActions;

    private double accuracyRate;

    // 平均评估耗时（毫秒）
    private double responseTime;

    private double falsePositiveRate;

    private double falseNegativeRate;

    private double communityAgreementRate;

    // 自动结案的决定数 / 处理内容数
    private double automationRate;

    private long contentVolumeProcessed;

    private double averageQualityScore;

    private int feedbackVotes;

    private int resolvedItems;

    // 队列项从入队到处理的平均分钟数
    private double meanResolutionMinutes;
}
