package com.community.moderation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReportPriority {
    MEDIUM("medium", Severity.MEDIUM),
    HIGH("high", Severity.HIGH),
    URGENT("urgent", Severity.CRITICAL);

    private final String code;
    // 举报入队时使用的严重程度
    private final Severity queueSeverity;

    ReportPriority(String code, Severity queueSeverity) {
        this.code = code;
        this.queueSeverity = queueSeverity;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Severity getQueueSeverity() {
        return queueSeverity;
    }
}
