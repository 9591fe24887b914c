package com.community.moderation.scoring;

import com.community.moderation.config.ModerationProperties;
import com.community.moderation.exception.ScorerUnavailableException;
import com.community.moderation.model.ContentType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimedSignalScorerTest {

    private ExecutorService executor;
    private ModerationProperties properties;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        properties = new ModerationProperties();
        properties.getScorer().setTimeoutMs(100);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testScore_ClampsDelegateResult() {
        TimedSignalScorer scorer = new TimedSignalScorer(
                (content, type) -> new SignalScores(1.4, 0.2, 0.5, 0.0, new LinkedHashSet<>()), executor, properties);

        SignalScores scores = scorer.score("text", ContentType.FORUM_POST);

        assertEquals(1.0, scores.getSpam());
    }

    // 超时必须转换为 ScorerUnavailableException
    @Test
    void testScore_Timeout() {
        TimedSignalScorer scorer = new TimedSignalScorer((content, type) -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new SignalScores();
        }, executor, properties);

        assertThrows(ScorerUnavailableException.class, () -> scorer.score("text", ContentType.FORUM_POST));
    }

    @Test
    void testScore_DelegateFailure() {
        TimedSignalScorer scorer = new TimedSignalScorer((content, type) -> {
            throw new IllegalStateException("model offline");
        }, executor, properties);

        assertThrows(ScorerUnavailableException.class, () -> scorer.score("text", ContentType.FORUM_POST));
    }

    @Test
    void testScore_NullResult() {
        TimedSignalScorer scorer = new TimedSignalScorer((content, type) -> null, executor, properties);

        assertThrows(ScorerUnavailableException.class, () -> scorer.score("text", ContentType.FORUM_POST));
    }
}
