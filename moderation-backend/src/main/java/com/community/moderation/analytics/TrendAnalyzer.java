package com.community.moderation.analytics;

import com.community.moderation.dto.analytics.OverviewMetrics;
import com.community.moderation.dto.analytics.Timeframe;
import com.community.moderation.dto.analytics.TrendPrediction;
import com.community.moderation.model.TrendDirection;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 趋势分析：当前窗口与之前若干等长窗口的均值比较。
 * <p>
 * 置信度 = min(1, 样本量 / 30) × (1 - 历史窗口变异系数)，
 * 预测值 = 当前值 + 全序列线性回归斜率。
 */
@Component
public class TrendAnalyzer {

    // 相对变化小于该值视为平稳
    static final double STABLE_BAND = 0.05;
    // 样本量达到该值时置信度不再因样本受限
    static final double FULL_CONFIDENCE_SAMPLES = 30.0;
    private static final int SCALE = 4;

    /**
     * @param history 历史窗口指标，按时间从早到晚
     * @param current 当前窗口指标
     */
    public List<TrendPrediction> analyze(List<OverviewMetrics> history, OverviewMetrics current, Timeframe timeframe) {
        List<TrendPrediction> trends = new ArrayList<>();
        for (TrackedMetric metric : TrackedMetric.values()) {
            trends.add(analyzeMetric(metric, history, current, timeframe));
        }
        return trends;
    }

    TrendPrediction analyzeMetric(TrackedMetric metric, List<OverviewMetrics> history,
                                  OverviewMetrics current, Timeframe timeframe) {
        double currentValue = metric.valueOf(current);

        // --- 1. 历史基线 ---
        DescriptiveStatistics baseline = new DescriptiveStatistics();
        SimpleRegression regression = new SimpleRegression();
        long samples = metric.samplesOf(current);
        int index = 0;
        for (OverviewMetrics window : history) {
            double value = metric.valueOf(window);
            baseline.addValue(value);
            regression.addData(index++, value);
            samples += metric.samplesOf(window);
        }
        regression.addData(index, currentValue);

        double baselineMean = baseline.getN() == 0 ? currentValue : baseline.getMean();
        double changeRate;
        if (baselineMean == 0.0) {
            changeRate = currentValue > 0.0 ? 1.0 : 0.0;
        } else {
            changeRate = (currentValue - baselineMean) / Math.abs(baselineMean);
        }

        TrendDirection direction = TrendDirection.STABLE;
        if (changeRate > STABLE_BAND) {
            direction = TrendDirection.INCREASING;
        } else if (changeRate < -STABLE_BAND) {
            direction = TrendDirection.DECREASING;
        }

        // --- 2. 置信度 ---
        double variation = variation(baseline, baselineMean);
        double confidence = Math.min(1.0, samples / FULL_CONFIDENCE_SAMPLES) * (1.0 - variation);

        // --- 3. 预测 ---
        double slope = regression.getN() >= 2 ? regression.getSlope() : 0.0;
        if (Double.isNaN(slope)) {
            slope = 0.0;
        }
        double predicted = Math.max(0.0, currentValue + slope);
        if (metric.isRate()) {
            predicted = Math.min(1.0, predicted);
        }

        TrendPrediction trend = new TrendPrediction();
        trend.setMetric(metric.getCode());
        trend.setCurrentValue(round(currentValue));
        trend.setBaselineValue(round(baselineMean));
        trend.setPredictedValue(round(predicted));
        trend.setChangeRate(round(changeRate));
        trend.setTrend(direction);
        trend.setConfidence(round(confidence));
        trend.setSampleSize(samples);
        trend.setTimeframe(timeframe.getForecastLabel());
        trend.setFactors(factors(metric, direction, changeRate, samples, variation, baseline.getN()));
        return trend;
    }

    private double variation(DescriptiveStatistics baseline, double mean) {
        if (baseline.getN() < 2) {
            return 0.0;
        }
        double stdDev = baseline.getStandardDeviation();
        if (mean == 0.0) {
            return stdDev == 0.0 ? 0.0 : 1.0;
        }
        return Math.min(1.0, stdDev / Math.abs(mean));
    }

    private List<String> factors(TrackedMetric metric, TrendDirection direction, double changeRate,
                                 long samples, double variation, long windows) {
        List<String> factors = new ArrayList<>();
        if (direction == TrendDirection.STABLE) {
            factors.add(String.format(Locale.ROOT, "%s within %.0f%% of the previous %d windows",
                    metric.getDisplayName(), STABLE_BAND * 100, windows));
        } else {
            factors.add(String.format(Locale.ROOT, "%s %s %.1f%% versus the previous %d windows",
                    metric.getDisplayName(), direction.getCode(), Math.abs(changeRate) * 100, windows));
        }
        if (samples < FULL_CONFIDENCE_SAMPLES) {
            factors.add("Limited sample size (" + samples + " observations)");
        }
        if (variation > 0.5) {
            factors.add("High variance across historical windows");
        }
        return factors;
    }

    private double round(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
