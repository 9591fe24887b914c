package com.community.moderation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * moderation.* 配置项。阈值类参数都是可调的，不是算法不变量。
 */
@Data
@ConfigurationProperties(prefix = "moderation")
public class ModerationProperties {

    private Scorer scorer = new Scorer();
    private Policy policy = new Policy();
    private Rules rules = new Rules();
    private Feedback feedback = new Feedback();
    private Queue queue = new Queue();
    private Analytics analytics = new Analytics();

    @Data
    public static class Scorer {
        // 外部打分调用超时
        private long timeoutMs = 2000;
        private int poolSize = 4;
    }

    /**
     * 无规则命中时的默认阈值策略，作用于 max(spam, toxicity)
     */
    @Data
    public static class Policy {
        private double blockThreshold = 0.85;
        private double reviewThreshold = 0.6;
        private double flagThreshold = 0.4;
    }

    @Data
    public static class Rules {
        private double defaultActivationThreshold = 0.6;
        private double minActivationThreshold = 0.4;
        private double maxActivationThreshold = 0.9;
        // 社区反馈驱动的单次阈值调整步长
        private double thresholdStep = 0.02;
        private long refreshIntervalMs = 300_000;
        private String seedLocation = "classpath:rules/default-rules.json";
    }

    @Data
    public static class Feedback {
        // 单个投票者在一个队列项总权重中的最大占比
        private double maxVoterShare = 0.2;
        private int minVotesForAdjustment = 2;
        private int minVoterScore = 50;
        // 共识判定（overturn 建议）所需的最少票数
        private int minVotesForConsensus = 5;
    }

    @Data
    public static class Queue {
        private int defaultLimit = 20;
        private int maxLimit = 100;
    }

    @Data
    public static class Analytics {
        private double alertConfidenceFloor = 0.7;
        // 趋势对比使用的历史窗口数
        private int historyWindows = 4;
        private long alertCheckIntervalMs = 300_000;
    }
}
