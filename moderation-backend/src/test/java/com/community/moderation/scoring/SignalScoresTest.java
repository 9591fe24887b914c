package com.community.moderation.scoring;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class SignalScoresTest {

    @Test
    void testClamped() {
        SignalScores scores = new SignalScores(1.7, -0.2, Double.NaN, 0.3, null).clamped();

        assertEquals(1.0, scores.getSpam());
        assertEquals(0.0, scores.getToxicity());
        assertEquals(0.0, scores.getQuality());
        assertEquals(0.3, scores.getCulturalAdjustment());
        assertEquals(Collections.emptySet(), scores.getFlags());
    }

    // 乘性衰减：0.9 × (1 - 0.5) = 0.45
    @Test
    void testCulturalAdjustmentDampensRisk() {
        SignalScores scores = new SignalScores(0.9, 0.6, 0.5, 0.5,
                new LinkedHashSet<>(Arrays.asList(SignalScores.FLAG_BILINGUAL)));

        SignalScores adjusted = scores.withCulturalAdjustment();

        assertEquals(0.45, adjusted.getSpam(), 1e-9);
        assertEquals(0.3, adjusted.getToxicity(), 1e-9);
        assertEquals(0.5, adjusted.getQuality(), 1e-9);
    }

    @Test
    void testNoCulturalFlagsLeavesScores() {
        SignalScores scores = new SignalScores(0.9, 0.6, 0.5, 0.5, new LinkedHashSet<>());

        assertSame(scores, scores.withCulturalAdjustment());
    }
}
