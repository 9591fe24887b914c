package com.community.moderation.dto.analytics;

import com.community.moderation.model.TrendDirection;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class TrendPrediction {

    private String metric;

    private double currentValue;

    // 历史窗口均值
    private double baselineValue;

    private double predictedValue;

    // 相对基线的变化率
    private double changeRate;

    private TrendDirection trend;

    private double confidence;

    private long sampleSize;

    private String timeframe;

    private List<String> factors = new ArrayList<>();
}
