package com.community.moderation.scoring;

import com.community.moderation.config.ModerationProperties;
import com.community.moderation.exception.ScorerUnavailableException;
import com.community.moderation.model.ContentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 在独立线程池上调用打分器并施加超时。超时、异常或空结果统一抛出 ScorerUnavailableException。
 */
@Component
public class TimedSignalScorer {

    private static final Logger log = LoggerFactory.getLogger(TimedSignalScorer.class);

    private final SignalScorer delegate;
    private final ExecutorService scorerExecutor;
    private final ModerationProperties properties;

    public TimedSignalScorer(SignalScorer delegate, ExecutorService scorerExecutor, ModerationProperties properties) {
        this.delegate = delegate;
        this.scorerExecutor = scorerExecutor;
        this.properties = properties;
    }

    public SignalScores score(String content, ContentType contentType) {
        long timeoutMs = properties.getScorer().getTimeoutMs();
        Future<SignalScores> future = CompletableFuture.supplyAsync(
                () -> delegate.score(content, contentType), scorerExecutor);
        try {
            SignalScores scores = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (scores == null) {
                throw new ScorerUnavailableException("Signal scorer returned no result");
            }
            return scores.clamped();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("打分服务超时 ({} ms)", timeoutMs);
            throw new ScorerUnavailableException("Signal scorer timed out after " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            log.warn("打分服务调用失败: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            throw new ScorerUnavailableException("Signal scorer failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScorerUnavailableException("Interrupted while waiting for signal scorer", e);
        }
    }
}
