package com.community.moderation.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(ModerationProperties.class)
public class ModerationConfig {

    /**
     * 所有依赖"当前时间"的组件统一使用该时钟，测试中可替换为固定时钟
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 外部打分调用专用线程池，超时由 TimedSignalScorer 控制
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService scorerExecutor(ModerationProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "signal-scorer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getScorer().getPoolSize(), factory);
    }
}
