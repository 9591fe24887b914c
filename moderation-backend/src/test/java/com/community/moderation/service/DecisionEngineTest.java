package com.community.moderation.service;

import com.community.moderation.config.ModerationProperties;
import com.community.moderation.dto.ModerationResult;
import com.community.moderation.entity.ModerationRule;
import com.community.moderation.model.ContentType;
import com.community.moderation.model.DecisionAction;
import com.community.moderation.model.EvaluationContext;
import com.community.moderation.model.ReputationSnapshot;
import com.community.moderation.model.Severity;
import com.community.moderation.model.TrustTier;
import com.community.moderation.rule.RuleAction;
import com.community.moderation.rule.RuleCondition;
import com.community.moderation.rule.RuleEngine;
import com.community.moderation.scoring.HeuristicSignalScorer;
import com.community.moderation.scoring.SignalScores;
import com.community.moderation.scoring.TimedSignalScorer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DecisionEngineTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 4, 14, 0);
    private static final String PROMO_TEXT = "Special discount! Visit now! Limited offer!";

    @Mock
    private TimedSignalScorer signalScorer;

    @Mock
    private ReputationService reputationService;

    private ModerationProperties properties;
    private RuleEngine ruleEngine;
    private DecisionEngine decisionEngine;

    @BeforeEach
    void setUp() {
        properties = new ModerationProperties();
        ruleEngine = new RuleEngine(properties);
        Clock clock = Clock.fixed(Instant.parse("2025-03-04T14:00:00Z"), ZoneOffset.UTC);
        decisionEngine = new DecisionEngine(signalScorer, reputationService, ruleEngine, properties, clock);
    }

    // 新用户发布推广内容：高风险规则直接拦截
    @Test
    void testNewUserPromotionalContentIsBlocked() throws IOException {
        ruleEngine.load(seedRules());
        givenScores(new SignalScores(0.9, 0.0, 0.2, 0.0, flags("promotional_keywords", "contains_links")));
        givenAuthor("newbie", 100, TrustTier.NEW);

        ModerationResult result = decisionEngine.evaluate("c1", "promo text", "newbie", context());

        assertEquals(DecisionAction.BLOCK, result.getAction());
        assertTrue(result.getSeverity().getRank() >= Severity.HIGH.getRank());
        assertTrue(result.isShouldFlag());
        assertEquals("high-risk-block", result.getWinningRuleId());
        assertTrue(result.getRuleIdsTriggered().contains("new-user-promotional"));
        assertFalse(result.isQueueBypassed());
    }

    // 专家在专业语境下发布同样内容：只做低级别标记并可绕过常规队列
    @Test
    void testExpertInProfessionalContextIsFlaggedLow() throws IOException {
        ruleEngine.load(seedRules());
        givenScores(new SignalScores(0.9, 0.0, 0.6, 0.0, flags("promotional_keywords")));
        givenAuthor("expert", 350, TrustTier.EXPERT);
        EvaluationContext context = context();
        context.getContextFlags().add("professional_context");

        ModerationResult result = decisionEngine.evaluate("c2", "product review", "expert", context);

        assertEquals(DecisionAction.FLAG, result.getAction());
        assertEquals(Severity.LOW, result.getSeverity());
        assertEquals("professional-context-established", result.getWinningRuleId());
        assertTrue(result.isQueueBypassed());
        assertEquals(TrustTier.EXPERT, result.getAuthorTier());
    }

    // 专家在专业语境下发布高毒性内容：专业语境规则不生效，照常拦截
    @Test
    void testExpertInProfessionalContextWithSevereToxicityIsBlocked() throws IOException {
        ruleEngine.load(seedRules());
        givenScores(new SignalScores(0.1, 0.95, 0.2, 0.0, flags("toxic_language", "aggressive_tone")));
        givenAuthor("expert", 350, TrustTier.EXPERT);
        EvaluationContext context = context();
        context.getContextFlags().add("professional_context");

        ModerationResult result = decisionEngine.evaluate("c6", "abusive text", "expert", context);

        assertEquals(DecisionAction.BLOCK, result.getAction());
        assertEquals(Severity.CRITICAL, result.getSeverity());
        assertFalse(result.getRuleIdsTriggered().contains("professional-context-established"));
        assertFalse(result.isQueueBypassed());
    }

    // 毒性达到拦截阈值时，宽松规则给出的动作和严重程度被抬高
    @Test
    void testLenientRuleCannotLowerSevereToxicity() {
        ModerationRule lenient = new ModerationRule();
        lenient.setRuleId("lenient");
        lenient.setName("lenient");
        lenient.setPriority(100);
        lenient.setConditions(Collections.singletonList(
                new RuleCondition("reputation.score", "greater_or_equal", 0, 1.0)));
        RuleAction flagLow = new RuleAction("flag");
        flagLow.getParameters().put("severity", "low");
        lenient.setActions(Collections.singletonList(flagLow));
        ruleEngine.load(Collections.singletonList(lenient));
        givenScores(new SignalScores(0.0, 0.9, 0.3, 0.0, flags("toxic_language")));
        givenAuthor("admin", 1200, TrustTier.ADMIN);

        ModerationResult result = decisionEngine.evaluate("c7", "abusive text", "admin", context());

        assertEquals("lenient", result.getWinningRuleId());
        assertEquals(DecisionAction.BLOCK, result.getAction());
        assertEquals(Severity.CRITICAL, result.getSeverity());
        assertFalse(result.isQueueBypassed());
    }

    // 真实启发式打分 + 默认规则：新用户的推广文本被拦截
    @Test
    void testPromotionalTextFromNewUserEndToEnd() throws IOException {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            DecisionEngine engine = heuristicEngine(executor);
            givenAuthor("newbie", 100, TrustTier.NEW);

            ModerationResult result = engine.evaluate("c8", PROMO_TEXT, "newbie", context());

            assertEquals(0.9, result.getScores().getSpam(), 1e-9);
            assertEquals(0.0, result.getScores().getToxicity(), 1e-9);
            assertTrue(result.getFlags().contains("promotional_keywords"));
            assertEquals(DecisionAction.BLOCK, result.getAction());
            assertEquals(Severity.CRITICAL, result.getSeverity());
            assertEquals("high-risk-block", result.getWinningRuleId());
            assertTrue(result.getRuleIdsTriggered().contains("new-user-promotional"));
            assertFalse(result.isQueueBypassed());
        } finally {
            executor.shutdownNow();
        }
    }

    // 同样文本，专家在专业语境下只做低级别标记
    @Test
    void testPromotionalTextFromExpertInProfessionalContextEndToEnd() throws IOException {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            DecisionEngine engine = heuristicEngine(executor);
            givenAuthor("expert", 350, TrustTier.EXPERT);
            EvaluationContext context = context();
            context.getContextFlags().add("professional_context");

            ModerationResult result = engine.evaluate("c9", PROMO_TEXT, "expert", context);

            assertEquals(DecisionAction.FLAG, result.getAction());
            assertEquals(Severity.LOW, result.getSeverity());
            assertEquals("professional-context-established", result.getWinningRuleId());
            assertTrue(result.isQueueBypassed());
        } finally {
            executor.shutdownNow();
        }
    }

    // 没有规则命中时使用默认阈值策略
    @Test
    void testDefaultPolicyWhenNoRuleMatches() {
        ruleEngine.load(Collections.<ModerationRule>emptyList());
        givenScores(new SignalScores(0.7, 0.2, 0.5, 0.0, flags()));
        givenAuthor("u1", 200, TrustTier.TRUSTED);

        ModerationResult result = decisionEngine.evaluate("c3", "text", "u1", context());

        assertEquals(DecisionAction.REVIEW, result.getAction());
        assertEquals(Severity.HIGH, result.getSeverity());
        assertEquals(0.7, result.getConfidence(), 1e-9);
        assertNull(result.getWinningRuleId());
        assertEquals("Automated: spam 0.70, toxicity 0.20", result.getReason());
    }

    @Test
    void testDefaultPolicyAllowsCleanContent() {
        ruleEngine.load(Collections.<ModerationRule>emptyList());
        givenScores(new SignalScores(0.1, 0.05, 0.8, 0.0, flags()));
        givenAuthor("u1", 100, TrustTier.NEW);

        ModerationResult result = decisionEngine.evaluate("c4", "hello world", "u1", context());

        assertEquals(DecisionAction.ALLOW, result.getAction());
        assertFalse(result.isShouldFlag());
        assertEquals(0.9, result.getConfidence(), 1e-9);
        assertEquals(NOW, result.getComputedAt());
    }

    // 双语内容的风险按文化语境衰减，原始分数原样保留
    @Test
    void testCulturalAdjustmentLowersDecision() {
        ruleEngine.load(Collections.<ModerationRule>emptyList());
        givenScores(new SignalScores(0.9, 0.0, 0.5, 0.5, flags(SignalScores.FLAG_BILINGUAL)));
        givenAuthor("u2", 100, TrustTier.NEW);

        ModerationResult result = decisionEngine.evaluate("c5", "arre yaar", "u2", context());

        assertEquals(0.9, result.getScores().getSpam(), 1e-9);
        assertEquals(0.45, result.getAdjustedScores().getSpam(), 1e-9);
        assertEquals(DecisionAction.FLAG, result.getAction());
        assertEquals(Severity.MEDIUM, result.getSeverity());
    }

    @Test
    void testApplyDefaultPolicyBoundaries() {
        assertEquals(DecisionAction.BLOCK, decisionEngine.applyDefaultPolicy(0.85));
        assertEquals(DecisionAction.REVIEW, decisionEngine.applyDefaultPolicy(0.6));
        assertEquals(DecisionAction.FLAG, decisionEngine.applyDefaultPolicy(0.4));
        assertEquals(DecisionAction.ALLOW, decisionEngine.applyDefaultPolicy(0.39));
    }

    private DecisionEngine heuristicEngine(ExecutorService executor) throws IOException {
        RuleEngine rules = new RuleEngine(properties);
        rules.load(seedRules());
        TimedSignalScorer scorer = new TimedSignalScorer(new HeuristicSignalScorer(), executor, properties);
        Clock clock = Clock.fixed(Instant.parse("2025-03-04T14:00:00Z"), ZoneOffset.UTC);
        return new DecisionEngine(scorer, reputationService, rules, properties, clock);
    }

    private void givenScores(SignalScores scores) {
        when(signalScorer.score(anyString(), any())).thenReturn(scores);
    }

    private void givenAuthor(String userId, int score, TrustTier tier) {
        when(reputationService.getSnapshot(userId)).thenReturn(new ReputationSnapshot(userId, score, tier, null));
    }

    private static EvaluationContext context() {
        return new EvaluationContext(ContentType.FORUM_POST, NOW, new LinkedHashSet<>());
    }

    private static Set<String> flags(String... flags) {
        return new LinkedHashSet<>(Arrays.asList(flags));
    }

    static List<ModerationRule> seedRules() throws IOException {
        try (InputStream in = DecisionEngineTest.class.getResourceAsStream("/rules/default-rules.json")) {
            return new ObjectMapper().readValue(in, new TypeReference<List<ModerationRule>>() { });
        }
    }
}
