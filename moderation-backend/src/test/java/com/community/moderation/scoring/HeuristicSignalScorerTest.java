package com.community.moderation.scoring;

import com.community.moderation.model.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeuristicSignalScorerTest {

    private HeuristicSignalScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new HeuristicSignalScorer();
    }

    // 推广文本：关键词、感叹号、大写与链接叠加
    @Test
    void testPromotionalTextScoresHighSpam() {
        SignalScores scores = scorer.score(
                "SPECIAL DISCOUNT OFFER!!! Buy now at www.deals.com, limited time deal!", ContentType.FORUM_POST);

        assertTrue(scores.getSpam() >= 0.85, "spam was " + scores.getSpam());
        assertTrue(scores.hasFlag("promotional_keywords"));
        assertTrue(scores.hasFlag("contains_links"));
        assertTrue(scores.getSpam() <= 1.0);
    }

    @Test
    void testOrdinaryQuestionIsLowRisk() {
        SignalScores scores = scorer.score(
                "Could you please explain how the garden irrigation schedule works in summer?", ContentType.QUESTION);

        assertEquals(0.0, scores.getSpam(), 1e-9);
        assertEquals(0.0, scores.getToxicity(), 1e-9);
        assertEquals(0.55, scores.getQuality(), 1e-9);
        assertTrue(scores.getFlags().isEmpty());
    }

    @Test
    void testAbusiveLanguage() {
        SignalScores scores = scorer.score("Shut up, you idiot. Nobody wants your terrible advice here.",
                ContentType.COMMENT);

        assertTrue(scores.getToxicity() >= 0.6);
        assertTrue(scores.hasFlag("toxic_language"));
        assertTrue(scores.hasFlag("aggressive_tone"));
    }

    // 双语与地域习语产生文化语境衰减，上限 0.5
    @Test
    void testCulturalContext() {
        SignalScores scores = scorer.score("arre yaar bahut accha hai ye jugaad, sabko try karna chahiye",
                ContentType.COMMENT);

        assertTrue(scores.hasFlag(SignalScores.FLAG_BILINGUAL));
        assertTrue(scores.hasFlag(SignalScores.FLAG_REGIONAL_IDIOM));
        assertEquals(0.5, scores.getCulturalAdjustment(), 1e-9);
    }

    @Test
    void testEmptyContent() {
        SignalScores scores = scorer.score(null, ContentType.FORUM_POST);

        // 过短文本计 0.2 spam
        assertEquals(0.2, scores.getSpam(), 1e-9);
        assertFalse(scores.hasFlag("contains_links"));
    }
}
