package com.community.moderation.service;

import com.community.moderation.dto.analytics.PredictiveAlert;
import com.community.moderation.dto.analytics.RealTimeSnapshot;
import com.community.moderation.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 定时刷新实时视图并输出预测告警。同一告警 id 只记录一次。
 */
@Component
public class AnalyticsAlertJob {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsAlertJob.class);
    private static final int MAX_REMEMBERED_ALERTS = 500;

    private final ModerationAnalyticsService analyticsService;

    // 仅由调度线程访问
    private final Set<String> reportedAlertIds = new LinkedHashSet<>();

    public AnalyticsAlertJob(ModerationAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @Scheduled(fixedDelayString = "${moderation.analytics.alert-check-interval-ms:300000}",
               initialDelayString = "${moderation.analytics.alert-check-interval-ms:300000}")
    public void checkAlerts() {
        RealTimeSnapshot snapshot;
        try {
            snapshot = analyticsService.realTime();
        } catch (StoreUnavailableException e) {
            log.error("实时分析刷新失败，本轮跳过: {}", e.getMessage());
            return;
        }

        int fresh = 0;
        for (PredictiveAlert alert : snapshot.getActiveAlerts()) {
            if (reportedAlertIds.add(alert.getId())) {
                fresh++;
                log.warn("预测告警 [{}] {}: {} (probability={}, timeframe={})",
                        alert.getSeverity().getCode(), alert.getType().getCode(), alert.getPrediction(),
                        alert.getProbability(), alert.getTimeframe());
            }
        }
        while (reportedAlertIds.size() > MAX_REMEMBERED_ALERTS) {
            String oldest = reportedAlertIds.iterator().next();
            reportedAlertIds.remove(oldest);
        }

        log.info("实时视图刷新: 处理 {} 条, 队列积压 {} (critical {}), 健康度 {}, 新告警 {}",
                snapshot.getProcessedCount(), snapshot.getQueueBacklog(), snapshot.getCriticalBacklog(),
                snapshot.getSystemHealth(), fresh);
    }
}
