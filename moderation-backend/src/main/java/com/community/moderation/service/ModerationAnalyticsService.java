package com.community.moderation.service;

import com.community.moderation.dto.analytics.AnalyticsExport;
import com.community.moderation.dto.analytics.AnalyticsPatterns;
import com.community.moderation.dto.analytics.AnalyticsReport;
import com.community.moderation.dto.analytics.OverviewMetrics;
import com.community.moderation.dto.analytics.PerformanceOptimization;
import com.community.moderation.dto.analytics.PredictiveAlert;
import com.community.moderation.dto.analytics.RealTimeSnapshot;
import com.community.moderation.dto.analytics.Timeframe;
import com.community.moderation.dto.analytics.TrendPrediction;

import java.util.List;

/**
 * 审核分析。只读历史数据，存储不可用时抛出 StoreUnavailableException，不返回伪造数据。
 */
public interface ModerationAnalyticsService {

    /**
     * 按 period 或显式起止时间确定分析窗口；显式时间优先
     */
    Timeframe resolveTimeframe(String period, String startDate, String endDate);

    AnalyticsReport generateReport(Timeframe timeframe);

    OverviewMetrics overview(Timeframe timeframe);

    List<TrendPrediction> trends(Timeframe timeframe);

    AnalyticsPatterns patterns(Timeframe timeframe);

    List<PerformanceOptimization> optimizations(Timeframe timeframe);

    List<PredictiveAlert> alerts(Timeframe timeframe);

    /**
     * 最近一小时的实时视图
     */
    RealTimeSnapshot realTime();

    AnalyticsExport export(Timeframe timeframe, String format);
}
