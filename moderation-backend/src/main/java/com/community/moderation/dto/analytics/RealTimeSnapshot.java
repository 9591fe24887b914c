package com.community.moderation.dto.analytics;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
public class RealTimeSnapshot {

    public static final String HEALTHY = "healthy";
    public static final String WARNING = "warning";
    public static final String CRITICAL = "critical";

    private LocalDateTime windowStart;

    private LocalDateTime windowEnd;

    private long processedCount;

    private double meanResponseTimeMs;

    private double automationRate;

    private double accuracyRate;

    // 当前 pending + reviewing
    private long queueBacklog;

    private long criticalBacklog;

    private List<PredictiveAlert> activeAlerts = new ArrayList<>();

    private String systemHealth;

    private LocalDateTime generatedAt;
}
