package com.community.moderation.analytics;

import com.community.moderation.dto.analytics.ContentInsight;
import com.community.moderation.dto.analytics.UserBehaviorPattern;
import com.community.moderation.entity.ContentReport;
import com.community.moderation.entity.ModerationDecision;
import com.community.moderation.model.ContentType;
import com.community.moderation.model.DecisionAction;
import com.community.moderation.model.RiskLevel;
import com.community.moderation.model.TrustTier;
import com.community.moderation.scoring.SignalScores;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 内容模式与用户行为模式识别，按出现频次排序
 */
@Component
public class PatternAnalyzer {

    static final int MAX_INSIGHTS = 10;
    private static final int MAX_EXAMPLES = 3;
    static final int REPEAT_OFFENDER_VIOLATIONS = 3;
    static final int NEW_USER_CLUSTER_VIOLATIONS = 2;
    static final int FALSE_REPORT_THRESHOLD = 2;

    private static final Map<String, String> FLAG_RECOMMENDATIONS = new HashMap<>();

    static {
        FLAG_RECOMMENDATIONS.put("promotional_keywords", "Update spam keyword lists and tighten rules for promotional content");
        FLAG_RECOMMENDATIONS.put("contains_links", "Require review for links posted by new accounts");
        FLAG_RECOMMENDATIONS.put("contact_info", "Discourage contact details in public posts and point users to private messages");
        FLAG_RECOMMENDATIONS.put("excessive_caps", "Nudge authors about formatting before posting");
        FLAG_RECOMMENDATIONS.put("toxic_language", "Escalate toxic language to moderators and review repeat authors");
        FLAG_RECOMMENDATIONS.put("aggressive_tone", "Show civility prompts before heated replies are posted");
        FLAG_RECOMMENDATIONS.put("low_quality", "Prompt authors for more detail before posting");
        FLAG_RECOMMENDATIONS.put(SignalScores.FLAG_BILINGUAL,
                "Review cultural calibration so bilingual posts are not over-flagged");
        FLAG_RECOMMENDATIONS.put(SignalScores.FLAG_REGIONAL_IDIOM,
                "Review cultural calibration so regional expressions are not over-flagged");
    }

    public List<ContentInsight> contentInsights(AnalyticsDataset dataset) {
        Map<String, ContentInsight> byPattern = new LinkedHashMap<>();
        for (ModerationDecision decision : dataset.getDecisions()) {
            if (decision.getAction() == DecisionAction.ALLOW || decision.getSignalFlags() == null) {
                continue;
            }
            for (String flag : new LinkedHashSet<>(decision.getSignalFlags())) {
                String key = decision.getContentType() + "|" + flag;
                ContentInsight insight = byPattern.computeIfAbsent(key,
                        k -> newInsight(decision.getContentType(), flag));
                insight.setFrequency(insight.getFrequency() + 1);
                if (insight.getExamples().size() < MAX_EXAMPLES
                        && !insight.getExamples().contains(decision.getContentId())) {
                    insight.getExamples().add(decision.getContentId());
                }
            }
        }

        List<ContentInsight> insights = new ArrayList<>(byPattern.values());
        insights.sort(Comparator.comparingInt(ContentInsight::getFrequency).reversed()
                .thenComparing(ContentInsight::getPattern)
                .thenComparing(insight -> insight.getContentType().getCode()));
        return insights.size() > MAX_INSIGHTS ? new ArrayList<>(insights.subList(0, MAX_INSIGHTS)) : insights;
    }

    private ContentInsight newInsight(ContentType contentType, String flag) {
        ContentInsight insight = new ContentInsight();
        insight.setContentType(contentType);
        insight.setPattern(flag);
        boolean cultural = SignalScores.FLAG_BILINGUAL.equals(flag) || SignalScores.FLAG_REGIONAL_IDIOM.equals(flag);
        insight.setImpact(cultural ? ContentInsight.IMPACT_NEUTRAL : ContentInsight.IMPACT_NEGATIVE);
        insight.setRecommendation(FLAG_RECOMMENDATIONS.getOrDefault(flag, "Review moderation rules covering " + flag));
        return insight;
    }

    public List<UserBehaviorPattern> userPatterns(AnalyticsDataset dataset) {
        // --- 1. 按作者统计违规次数（非 allow 的决定）---
        Map<String, Integer> violations = new HashMap<>();
        Map<String, TrustTier> latestTier = new HashMap<>();
        Set<String> restrictedAuthors = new LinkedHashSet<>();
        for (ModerationDecision decision : dataset.getDecisions()) {
            String authorId = decision.getAuthorId();
            if (authorId == null) {
                continue;
            }
            if (decision.getAuthorTier() != null) {
                latestTier.put(authorId, decision.getAuthorTier());
                if (decision.getAuthorTier() == TrustTier.RESTRICTED) {
                    restrictedAuthors.add(authorId);
                }
            }
            if (decision.getAction() != DecisionAction.ALLOW) {
                violations.merge(authorId, 1, Integer::sum);
            }
        }

        int newUserCluster = 0;
        int repeatOffenders = 0;
        for (Map.Entry<String, Integer> entry : violations.entrySet()) {
            if (latestTier.get(entry.getKey()) == TrustTier.NEW && entry.getValue() >= NEW_USER_CLUSTER_VIOLATIONS) {
                newUserCluster++;
            }
            if (entry.getValue() >= REPEAT_OFFENDER_VIOLATIONS) {
                repeatOffenders++;
            }
        }

        // --- 2. 举报被驳回的举报人 ---
        Map<String, Integer> dismissedByReporter = new HashMap<>();
        for (ContentReport report : dataset.getResolvedReports()) {
            if (ContentReport.RESOLUTION_DISMISSED.equals(report.getResolution())) {
                dismissedByReporter.merge(report.getReporterId(), 1, Integer::sum);
            }
        }
        int falseReporters = 0;
        for (Integer count : dismissedByReporter.values()) {
            if (count >= FALSE_REPORT_THRESHOLD) {
                falseReporters++;
            }
        }

        List<UserBehaviorPattern> patterns = new ArrayList<>();
        if (newUserCluster > 0) {
            patterns.add(pattern("new_user_violation_cluster", newUserCluster, RiskLevel.HIGH,
                    "New users with multiple flagged posts in the window",
                    List.of("Multiple non-allow decisions", "Tier new at submission time"),
                    List.of("Increase review coverage for new users", "Add onboarding guidance before first post")));
        }
        if (repeatOffenders > 0) {
            patterns.add(pattern("repeat_offender", repeatOffenders, RiskLevel.HIGH,
                    "Authors with " + REPEAT_OFFENDER_VIOLATIONS + " or more flagged posts in the window",
                    List.of("Repeated non-allow decisions"),
                    List.of("Review account history", "Consider temporary posting limits")));
        }
        if (!restrictedAuthors.isEmpty()) {
            patterns.add(pattern("restricted_user_activity", restrictedAuthors.size(), RiskLevel.MEDIUM,
                    "Restricted users continuing to submit content",
                    List.of("Submissions from restricted tier"),
                    List.of("Verify restricted posting privileges are enforced")));
        }
        if (falseReporters > 0) {
            patterns.add(pattern("false_reporting", falseReporters, RiskLevel.MEDIUM,
                    "Reporters whose reports were repeatedly dismissed",
                    List.of(FALSE_REPORT_THRESHOLD + " or more dismissed reports"),
                    List.of("Send reporting guidelines", "Lower report priority for these reporters")));
        }
        patterns.sort(Comparator.comparingInt(UserBehaviorPattern::getUserCount).reversed()
                .thenComparing(UserBehaviorPattern::getPattern));
        return patterns;
    }

    private UserBehaviorPattern pattern(String name, int userCount, RiskLevel riskLevel, String description,
                                        List<String> indicators, List<String> suggestedActions) {
        UserBehaviorPattern pattern = new UserBehaviorPattern();
        pattern.setPattern(name);
        pattern.setUserCount(userCount);
        pattern.setRiskLevel(riskLevel);
        pattern.setDescription(description);
        pattern.setIndicators(new ArrayList<>(indicators));
        pattern.setSuggestedActions(new ArrayList<>(suggestedActions));
        return pattern;
    }
}
