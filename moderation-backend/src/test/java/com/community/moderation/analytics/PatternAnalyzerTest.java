package com.community.moderation.analytics;

import com.community.moderation.dto.analytics.ContentInsight;
import com.community.moderation.dto.analytics.Timeframe;
import com.community.moderation.dto.analytics.UserBehaviorPattern;
import com.community.moderation.entity.ContentReport;
import com.community.moderation.entity.ModerationDecision;
import com.community.moderation.model.AnalyticsPeriod;
import com.community.moderation.model.ContentType;
import com.community.moderation.model.DecisionAction;
import com.community.moderation.model.RiskLevel;
import com.community.moderation.model.TrustTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternAnalyzerTest {

    private static final LocalDateTime END = LocalDateTime.of(2025, 3, 10, 0, 0);

    private PatternAnalyzer analyzer;
    private AnalyticsDataset dataset;

    @BeforeEach
    void setUp() {
        analyzer = new PatternAnalyzer();
        dataset = AnalyticsDataset.empty(new Timeframe(AnalyticsPeriod.WEEK, END.minusDays(7), END));
    }

    // allow 的决定不计入内容模式
    @Test
    void testContentInsightsGroupedByTypeAndFlag() {
        dataset.getDecisions().add(decision("c1", "u1", TrustTier.NEW, DecisionAction.BLOCK,
                "promotional_keywords", "contains_links"));
        dataset.getDecisions().add(decision("c2", "u2", TrustTier.NEW, DecisionAction.REVIEW, "promotional_keywords"));
        dataset.getDecisions().add(decision("c3", "u3", TrustTier.TRUSTED, DecisionAction.FLAG, "bilingual"));
        dataset.getDecisions().add(decision("c4", "u4", TrustTier.TRUSTED, DecisionAction.ALLOW,
                "promotional_keywords"));

        List<ContentInsight> insights = analyzer.contentInsights(dataset);

        assertEquals(3, insights.size());
        ContentInsight top = insights.get(0);
        assertEquals("promotional_keywords", top.getPattern());
        assertEquals(2, top.getFrequency());
        assertEquals(ContentInsight.IMPACT_NEGATIVE, top.getImpact());
        assertEquals(List.of("c1", "c2"), top.getExamples());
        // 频次相同时按模式名排序
        assertEquals("bilingual", insights.get(1).getPattern());
        assertEquals(ContentInsight.IMPACT_NEUTRAL, insights.get(1).getImpact());
        assertEquals("contains_links", insights.get(2).getPattern());
    }

    @Test
    void testExamplesCapped() {
        for (int i = 0; i < 5; i++) {
            dataset.getDecisions().add(decision("c" + i, "u" + i, TrustTier.TRUSTED, DecisionAction.REVIEW,
                    "low_quality"));
        }

        ContentInsight insight = analyzer.contentInsights(dataset).get(0);

        assertEquals(5, insight.getFrequency());
        assertEquals(3, insight.getExamples().size());
    }

    @Test
    void testUserPatterns() {
        // u1：新用户 3 次违规，同时属于新用户聚集与惯犯
        dataset.getDecisions().add(decision("c1", "u1", TrustTier.NEW, DecisionAction.BLOCK, "toxic_language"));
        dataset.getDecisions().add(decision("c2", "u1", TrustTier.NEW, DecisionAction.REVIEW, "toxic_language"));
        dataset.getDecisions().add(decision("c3", "u1", TrustTier.NEW, DecisionAction.FLAG, "aggressive_tone"));
        // u2：新用户 2 次违规
        dataset.getDecisions().add(decision("c4", "u2", TrustTier.NEW, DecisionAction.REVIEW, "contains_links"));
        dataset.getDecisions().add(decision("c5", "u2", TrustTier.NEW, DecisionAction.REVIEW, "contains_links"));
        // u3：受限用户，内容被放行也计入
        dataset.getDecisions().add(decision("c6", "u3", TrustTier.RESTRICTED, DecisionAction.ALLOW));
        // r1 两次举报被驳回，r2 只有一次
        dataset.getResolvedReports().add(report("r1", ContentReport.RESOLUTION_DISMISSED));
        dataset.getResolvedReports().add(report("r1", ContentReport.RESOLUTION_DISMISSED));
        dataset.getResolvedReports().add(report("r2", ContentReport.RESOLUTION_DISMISSED));

        List<UserBehaviorPattern> patterns = analyzer.userPatterns(dataset);

        assertEquals(4, patterns.size());
        assertEquals("new_user_violation_cluster", patterns.get(0).getPattern());
        assertEquals(2, patterns.get(0).getUserCount());
        assertEquals(RiskLevel.HIGH, patterns.get(0).getRiskLevel());
        assertEquals("false_reporting", patterns.get(1).getPattern());
        assertEquals(RiskLevel.MEDIUM, patterns.get(1).getRiskLevel());
        assertEquals("repeat_offender", patterns.get(2).getPattern());
        assertEquals("restricted_user_activity", patterns.get(3).getPattern());
    }

    @Test
    void testNoPatternsForCleanWindow() {
        dataset.getDecisions().add(decision("c1", "u1", TrustTier.TRUSTED, DecisionAction.ALLOW));

        assertTrue(analyzer.userPatterns(dataset).isEmpty());
        assertTrue(analyzer.contentInsights(dataset).isEmpty());
    }

    private static ModerationDecision decision(String contentId, String authorId, TrustTier tier,
                                               DecisionAction action, String... flags) {
        ModerationDecision decision = new ModerationDecision();
        decision.setContentId(contentId);
        decision.setContentType(ContentType.FORUM_POST);
        decision.setAuthorId(authorId);
        decision.setAuthorTier(tier);
        decision.setAction(action);
        decision.setSignalFlags(new ArrayList<>(List.of(flags)));
        decision.setComputedAt(END.minusDays(1));
        return decision;
    }

    private static ContentReport report(String reporterId, String resolution) {
        ContentReport report = new ContentReport();
        report.setReporterId(reporterId);
        report.setResolution(resolution);
        return report;
    }
}
