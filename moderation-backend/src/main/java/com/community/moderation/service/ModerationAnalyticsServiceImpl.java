package com.community.moderation.service;

import com.community.moderation.analytics.AlertPredictor;
import com.community.moderation.analytics.AnalyticsDataset;
import com.community.moderation.analytics.MetricsCalculator;
import com.community.moderation.analytics.OptimizationAdvisor;
import com.community.moderation.analytics.PatternAnalyzer;
import com.community.moderation.analytics.TrendAnalyzer;
import com.community.moderation.config.ModerationProperties;
import com.community.moderation.dto.analytics.AnalyticsExport;
import com.community.moderation.dto.analytics.AnalyticsPatterns;
import com.community.moderation.dto.analytics.AnalyticsReport;
import com.community.moderation.dto.analytics.ContentInsight;
import com.community.moderation.dto.analytics.OverviewMetrics;
import com.community.moderation.dto.analytics.PerformanceOptimization;
import com.community.moderation.dto.analytics.PredictiveAlert;
import com.community.moderation.dto.analytics.RealTimeSnapshot;
import com.community.moderation.dto.analytics.Timeframe;
import com.community.moderation.dto.analytics.TrendPrediction;
import com.community.moderation.dto.analytics.UserBehaviorPattern;
import com.community.moderation.exception.StoreUnavailableException;
import com.community.moderation.exception.ValidationException;
import com.community.moderation.model.AnalyticsPeriod;
import com.community.moderation.model.QueueStatus;
import com.community.moderation.model.Severity;
import com.community.moderation.repository.ContentReportRepository;
import com.community.moderation.repository.FeedbackVoteRepository;
import com.community.moderation.repository.ModerationActionRepository;
import com.community.moderation.repository.ModerationDecisionRepository;
import com.community.moderation.repository.ModerationQueueRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVWriter;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
public class ModerationAnalyticsServiceImpl implements ModerationAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(ModerationAnalyticsServiceImpl.class);

    // 自定义时间窗口的最大跨度
    private static final Duration MAX_CUSTOM_RANGE = Duration.ofDays(366);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmm");
    private static final String[] CSV_HEADER = {"section", "name", "value"};

    private final ModerationDecisionRepository decisionRepository;
    private final ModerationActionRepository actionRepository;
    private final FeedbackVoteRepository voteRepository;
    private final ModerationQueueRepository queueRepository;
    private final ContentReportRepository reportRepository;
    private final MetricsCalculator metricsCalculator;
    private final TrendAnalyzer trendAnalyzer;
    private final PatternAnalyzer patternAnalyzer;
    private final OptimizationAdvisor optimizationAdvisor;
    private final AlertPredictor alertPredictor;
    private final ObjectMapper objectMapper;
    private final ModerationProperties properties;
    private final Clock clock;

    @Override
    public Timeframe resolveTimeframe(String period, String startDate, String endDate) {
        if (startDate != null || endDate != null) {
            if (startDate == null || endDate == null) {
                throw new ValidationException("startDate and endDate must be provided together");
            }
            LocalDateTime start = parseDateTime(startDate, "startDate");
            LocalDateTime end = parseDateTime(endDate, "endDate");
            if (!end.isAfter(start)) {
                throw new ValidationException("endDate must be after startDate");
            }
            if (Duration.between(start, end).compareTo(MAX_CUSTOM_RANGE) > 0) {
                throw new ValidationException("Custom range must not exceed 366 days");
            }
            return new Timeframe(AnalyticsPeriod.CUSTOM, start, end);
        }

        AnalyticsPeriod resolved = period == null || period.isBlank()
                ? AnalyticsPeriod.DAY
                : AnalyticsPeriod.fromCode(period);
        LocalDateTime end = LocalDateTime.now(clock);
        return new Timeframe(resolved, end.minus(resolved.getDuration()), end);
    }

    private LocalDateTime parseDateTime(String value, String field) {
        try {
            if (value.length() <= 10) {
                return LocalDate.parse(value).atStartOfDay();
            }
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException(field + " must be an ISO-8601 date or date-time: " + value);
        }
    }

    @Override
    public AnalyticsReport generateReport(Timeframe timeframe) {
        long start = System.currentTimeMillis();

        // --- 1. 读取当前窗口与历史窗口 ---
        AnalyticsDataset current = load(timeframe);
        List<OverviewMetrics> history = loadHistory(timeframe);

        // --- 2. 计算各部分 ---
        OverviewMetrics overview = metricsCalculator.calculate(current);
        List<TrendPrediction> trends = trendAnalyzer.analyze(history, overview, timeframe);
        List<ContentInsight> insights = patternAnalyzer.contentInsights(current);
        List<UserBehaviorPattern> userPatterns = patternAnalyzer.userPatterns(current);

        // --- 3. 组装报告 ---
        AnalyticsReport report = new AnalyticsReport();
        report.setTimeframe(timeframe);
        report.setGeneratedAt(LocalDateTime.now(clock));
        report.setOverview(overview);
        report.setTrends(trends);
        report.setContentInsights(insights);
        report.setUserPatterns(userPatterns);
        report.setOptimizations(optimizationAdvisor.optimizations(overview));
        report.setPredictiveAlerts(alertPredictor.predict(trends, timeframe, report.getGeneratedAt()));
        report.setRecommendations(optimizationAdvisor.recommendations(overview, trends, insights, userPatterns));

        log.info("分析报告生成完成: {} ~ {}，耗时 {} ms，告警 {} 条",
                timeframe.getStart(), timeframe.getEnd(), System.currentTimeMillis() - start,
                report.getPredictiveAlerts().size());
        return report;
    }

    @Override
    public OverviewMetrics overview(Timeframe timeframe) {
        return metricsCalculator.calculate(load(timeframe));
    }

    @Override
    public List<TrendPrediction> trends(Timeframe timeframe) {
        OverviewMetrics current = overview(timeframe);
        return trendAnalyzer.analyze(loadHistory(timeframe), current, timeframe);
    }

    @Override
    public AnalyticsPatterns patterns(Timeframe timeframe) {
        AnalyticsDataset dataset = load(timeframe);
        return new AnalyticsPatterns(patternAnalyzer.contentInsights(dataset), patternAnalyzer.userPatterns(dataset));
    }

    @Override
    public List<PerformanceOptimization> optimizations(Timeframe timeframe) {
        return optimizationAdvisor.optimizations(overview(timeframe));
    }

    @Override
    public List<PredictiveAlert> alerts(Timeframe timeframe) {
        return alertPredictor.predict(trends(timeframe), timeframe, LocalDateTime.now(clock));
    }

    @Override
    public RealTimeSnapshot realTime() {
        Timeframe lastHour = resolveTimeframe(AnalyticsPeriod.HOUR.getCode(), null, null);
        OverviewMetrics overview = overview(lastHour);
        List<TrendPrediction> trends = trendAnalyzer.analyze(loadHistory(lastHour), overview, lastHour);

        RealTimeSnapshot snapshot = new RealTimeSnapshot();
        snapshot.setWindowStart(lastHour.getStart());
        snapshot.setWindowEnd(lastHour.getEnd());
        snapshot.setProcessedCount(overview.getContentVolumeProcessed());
        snapshot.setMeanResponseTimeMs(overview.getResponseTime());
        snapshot.setAutomationRate(overview.getAutomationRate());
        snapshot.setAccuracyRate(overview.getAccuracyRate());
        try {
            snapshot.setQueueBacklog(queueRepository.countByStatus(QueueStatus.PENDING)
                    + queueRepository.countByStatus(QueueStatus.REVIEWING));
            snapshot.setCriticalBacklog(queueRepository.countByStatusInAndSeverity(QueueStatus.ACTIVE, Severity.CRITICAL));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Analytics store unavailable", e);
        }
        snapshot.setActiveAlerts(alertPredictor.predict(trends, lastHour, LocalDateTime.now(clock)));
        snapshot.setSystemHealth(systemHealth(overview));
        snapshot.setGeneratedAt(LocalDateTime.now(clock));
        return snapshot;
    }

    /**
     * 无反馈样本时不以准确率判定健康度
     */
    static String systemHealth(OverviewMetrics overview) {
        if (overview.getFeedbackVotes() == 0 || overview.getAccuracyRate() > 0.8) {
            return RealTimeSnapshot.HEALTHY;
        }
        if (overview.getAccuracyRate() > 0.6) {
            return RealTimeSnapshot.WARNING;
        }
        return RealTimeSnapshot.CRITICAL;
    }

    @Override
    public AnalyticsExport export(Timeframe timeframe, String format) {
        String resolvedFormat = format == null ? "json" : format.toLowerCase(Locale.ROOT);
        if (!"json".equals(resolvedFormat) && !"csv".equals(resolvedFormat)) {
            throw new ValidationException("Invalid export format: " + format + " (expected json or csv)");
        }
        AnalyticsReport report = generateReport(timeframe);
        String fileName = "moderation-analytics-" + timeframe.getEnd().format(FILE_STAMP) + "." + resolvedFormat;
        if ("json".equals(resolvedFormat)) {
            try {
                return new AnalyticsExport(resolvedFormat, fileName,
                        objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize analytics report", e);
            }
        }
        return new AnalyticsExport(resolvedFormat, fileName, toCsv(toRows(report)));
    }

    private String toCsv(List<CsvRow> rows) {
        StringWriter out = new StringWriter();
        // 只在字段含分隔符或引号时加引号
        try (CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(CSV_HEADER, false);
            for (CsvRow row : rows) {
                writer.writeNext(new String[]{row.getSection(), row.getName(), row.getValue()}, false);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write analytics CSV", e);
        }
        return out.toString();
    }

    private List<CsvRow> toRows(AnalyticsReport report) {
        List<CsvRow> rows = new ArrayList<>();
        OverviewMetrics o = report.getOverview();
        rows.add(new CsvRow("overview", "total_actions", String.valueOf(o.getTotalActions())));
        rows.add(new CsvRow("overview", "automated_actions", String.valueOf(o.getAutomatedActions())));
        rows.add(new CsvRow("overview", "accuracy_rate", String.valueOf(o.getAccuracyRate())));
        rows.add(new CsvRow("overview", "response_time", String.valueOf(o.getResponseTime())));
        rows.add(new CsvRow("overview", "false_positive_rate", String.valueOf(o.getFalsePositiveRate())));
        rows.add(new CsvRow("overview", "false_negative_rate", String.valueOf(o.getFalseNegativeRate())));
        rows.add(new CsvRow("overview", "community_agreement_rate", String.valueOf(o.getCommunityAgreementRate())));
        rows.add(new CsvRow("overview", "automation_rate", String.valueOf(o.getAutomationRate())));
        rows.add(new CsvRow("overview", "content_volume_processed", String.valueOf(o.getContentVolumeProcessed())));
        rows.add(new CsvRow("overview", "mean_resolution_minutes", String.valueOf(o.getMeanResolutionMinutes())));
        for (TrendPrediction trend : report.getTrends()) {
            rows.add(new CsvRow("trend", trend.getMetric(),
                    trend.getTrend().getCode() + " " + trend.getChangeRate() + " (confidence " + trend.getConfidence() + ")"));
        }
        for (ContentInsight insight : report.getContentInsights()) {
            rows.add(new CsvRow("content_insight", insight.getContentType().getCode() + ":" + insight.getPattern(),
                    String.valueOf(insight.getFrequency())));
        }
        for (UserBehaviorPattern pattern : report.getUserPatterns()) {
            rows.add(new CsvRow("user_pattern", pattern.getPattern(), String.valueOf(pattern.getUserCount())));
        }
        for (PerformanceOptimization optimization : report.getOptimizations()) {
            rows.add(new CsvRow("optimization", optimization.getArea(), String.valueOf(optimization.getPriority())));
        }
        for (PredictiveAlert alert : report.getPredictiveAlerts()) {
            rows.add(new CsvRow("alert", alert.getType().getCode(), alert.getSeverity().getCode()));
        }
        for (String recommendation : report.getRecommendations()) {
            rows.add(new CsvRow("recommendation", "", recommendation));
        }
        return rows;
    }

    private List<OverviewMetrics> loadHistory(Timeframe timeframe) {
        int windows = properties.getAnalytics().getHistoryWindows();
        List<OverviewMetrics> history = new ArrayList<>();
        // 从最早的窗口开始，保证序列按时间升序
        for (int i = windows; i >= 1; i--) {
            history.add(metricsCalculator.calculate(load(timeframe.shiftBack(i))));
        }
        return history;
    }

    private AnalyticsDataset load(Timeframe timeframe) {
        LocalDateTime start = timeframe.getStart();
        LocalDateTime end = timeframe.getEnd();
        try {
            return new AnalyticsDataset(
                    timeframe,
                    decisionRepository.findByComputedAtGreaterThanEqualAndComputedAtLessThan(start, end),
                    actionRepository.findByCreatedAtGreaterThanEqualAndCreatedAtLessThan(start, end),
                    voteRepository.findBySubmittedAtGreaterThanEqualAndSubmittedAtLessThan(start, end),
                    queueRepository.findByProcessedAtGreaterThanEqualAndProcessedAtLessThan(start, end),
                    reportRepository.findByResolvedAtGreaterThanEqualAndResolvedAtLessThan(start, end));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Analytics store unavailable", e);
        }
    }

    @Data
    @AllArgsConstructor
    private static class CsvRow {
        private String section;
        private String name;
        private String value;
    }
}
