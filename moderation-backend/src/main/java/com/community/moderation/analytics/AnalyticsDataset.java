package com.community.moderation.analytics;

import com.community.moderation.dto.analytics.Timeframe;
import com.community.moderation.entity.ContentReport;
import com.community.moderation.entity.FeedbackVote;
import com.community.moderation.entity.ModerationAction;
import com.community.moderation.entity.ModerationDecision;
import com.community.moderation.entity.ModerationQueueItem;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个时间窗口内读取到的原始记录，供各分析器计算
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsDataset {

    private Timeframe timeframe;

    private List<ModerationDecision> decisions = new ArrayList<>();

    private List<ModerationAction> actions = new ArrayList<>();

    private List<FeedbackVote> votes = new ArrayList<>();

    // 在窗口内被处理的队列项
    private List<ModerationQueueItem> resolvedItems = new ArrayList<>();

    // 在窗口内结案的举报
    private List<ContentReport> resolvedReports = new ArrayList<>();

    public static AnalyticsDataset empty(Timeframe timeframe) {
        AnalyticsDataset dataset = new AnalyticsDataset();
        dataset.setTimeframe(timeframe);
        return dataset;
    }
}
