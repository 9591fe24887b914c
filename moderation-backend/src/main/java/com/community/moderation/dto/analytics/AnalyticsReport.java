package com.community.moderation.dto.analytics;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 完整分析报告，每次按时间窗口重新计算，不持久化
 */
@Data
public class AnalyticsReport {

    private Timeframe timeframe;

    private LocalDateTime generatedAt;

    private OverviewMetrics overview;

    private List<TrendPrediction> trends = new ArrayList<>();

    private List<ContentInsight> contentInsights = new ArrayList<>();

    private List<UserBehaviorPattern> userPatterns = new ArrayList<>();

    private List<PerformanceOptimization> optimizations = new ArrayList<>();

    private List<PredictiveAlert> predictiveAlerts = new ArrayList<>();

    private List<String> recommendations = new ArrayList<>();
}
