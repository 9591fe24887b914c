package com.community.moderation.dto.analytics;

import com.community.moderation.model.AnalyticsPeriod;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 分析时间窗口 [start, end)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Timeframe {

    private AnalyticsPeriod period;

    private LocalDateTime start;

    private LocalDateTime end;

    @JsonIgnore
    public Duration getDuration() {
        return Duration.between(start, end);
    }

    /**
     * 向前平移若干个等长窗口，windowsBack=1 即紧邻的上一个窗口
     */
    public Timeframe shiftBack(int windowsBack) {
        Duration offset = getDuration().multipliedBy(windowsBack);
        return new Timeframe(period, start.minus(offset), end.minus(offset));
    }

    @JsonIgnore
    public String getForecastLabel() {
        if (period == null || period == AnalyticsPeriod.CUSTOM) {
            return "next " + getDuration().toHours() + " hours";
        }
        return "next " + period.getCode();
    }
}
