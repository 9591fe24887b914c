package com.community.moderation.service;

import com.community.moderation.config.ModerationProperties;
import com.community.moderation.dto.ModerationResult;
import com.community.moderation.dto.SignalScoresDTO;
import com.community.moderation.model.DecisionAction;
import com.community.moderation.model.EvaluationContext;
import com.community.moderation.model.ReputationSnapshot;
import com.community.moderation.model.Severity;
import com.community.moderation.rule.RuleActionType;
import com.community.moderation.rule.RuleEngine;
import com.community.moderation.rule.RuleEvaluation;
import com.community.moderation.rule.RuleMatch;
import com.community.moderation.rule.SignalBundle;
import com.community.moderation.scoring.SignalScores;
import com.community.moderation.scoring.TimedSignalScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * 决策引擎：打分 -> 读取信誉 -> 文化语境衰减 -> 规则引擎 / 默认阈值策略 -> 动作与严重程度。
 * 无状态，可对不同内容并行调用；只读信誉，不写任何状态。
 */
@Component
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final TimedSignalScorer signalScorer;
    private final ReputationService reputationService;
    private final RuleEngine ruleEngine;
    private final ModerationProperties properties;
    private final Clock clock;

    public DecisionEngine(TimedSignalScorer signalScorer, ReputationService reputationService,
                          RuleEngine ruleEngine, ModerationProperties properties, Clock clock) {
        this.signalScorer = signalScorer;
        this.reputationService = reputationService;
        this.ruleEngine = ruleEngine;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 打分服务不可用时抛出 ScorerUnavailableException，由调用方决定降级方式
     */
    public ModerationResult evaluate(String contentId, String content, String authorId, EvaluationContext context) {
        long startNanos = System.nanoTime();

        // --- 1. 打分并截断到 [0, 1] ---
        SignalScores raw = signalScorer.score(content, context.getContentType()).clamped();

        // --- 2. 作者信誉 ---
        ReputationSnapshot reputation = reputationService.getSnapshot(authorId);
        long accountAgeDays = reputation.getFirstSeenAt() == null ? 0
                : Math.max(0, Duration.between(reputation.getFirstSeenAt(), context.getSubmittedAt()).toDays());

        // --- 3. 文化语境衰减 ---
        SignalScores adjusted = raw.withCulturalAdjustment();

        // --- 4. 规则引擎，未命中则走默认阈值策略 ---
        SignalBundle bundle = SignalBundle.of(adjusted, reputation, context, content, accountAgeDays);
        RuleEvaluation evaluation = ruleEngine.evaluate(bundle);

        double riskMagnitude = adjusted.maxRisk();
        DecisionAction action;
        Severity severity;
        double confidence;
        String reason;
        List<String> sideEffects = new ArrayList<>();

        if (evaluation.hasWinner()) {
            RuleMatch winner = evaluation.getWinner();
            action = winner.getDecision();
            severity = winner.getSeverityOverride() != null
                    ? winner.getSeverityOverride()
                    : Severity.fromScore(riskMagnitude);
            confidence = winner.getMatchScore();
            reason = "Rule " + winner.getRuleId() + ": " + winner.getReason();
            for (RuleActionType effect : winner.getSideEffects()) {
                sideEffects.add(effect.getCode());
            }
            // 毒性达到拦截阈值时，规则只能加重不能放宽
            double toxicity = adjusted.getToxicity();
            if (toxicity >= properties.getPolicy().getBlockThreshold()) {
                if (action != DecisionAction.BLOCK) {
                    log.warn("规则 {} 对毒性 {} 的内容给出 {}，已按拦截处理", winner.getRuleId(), toxicity, action.getCode());
                    action = DecisionAction.BLOCK;
                }
                Severity floor = Severity.fromScore(toxicity);
                if (severity.getRank() < floor.getRank()) {
                    severity = floor;
                }
            }
        } else {
            action = applyDefaultPolicy(riskMagnitude);
            severity = Severity.fromScore(riskMagnitude);
            confidence = action == DecisionAction.ALLOW ? 1.0 - riskMagnitude : riskMagnitude;
            reason = describeSignals(adjusted);
        }

        // --- 5. 组装结果 ---
        ModerationResult result = new ModerationResult();
        result.setEvaluationId(UUID.randomUUID().toString());
        result.setContentId(contentId);
        result.setContentType(context.getContentType());
        result.setAuthorId(authorId);
        result.setScores(SignalScoresDTO.from(raw));
        result.setAdjustedScores(SignalScoresDTO.from(adjusted));
        result.setFlags(new ArrayList<>(adjusted.getFlags()));
        result.setAction(action);
        result.setShouldFlag(action != DecisionAction.ALLOW);
        result.setSeverity(severity);
        result.setConfidence(Math.max(0.0, Math.min(1.0, confidence)));
        result.setRuleIdsTriggered(evaluation.getTriggeredRuleIds());
        result.setWinningRuleId(evaluation.hasWinner() ? evaluation.getWinner().getRuleId() : null);
        result.setSideEffects(sideEffects);
        result.setReason(reason);
        result.setAuthorTier(reputation.getTrustTier());
        result.setAuthorScore(reputation.getOverallScore());
        result.setQueueBypassed(action == DecisionAction.FLAG && severity == Severity.LOW
                && reputation.getTrustTier().canBypassRoutineQueue());
        result.setComputedAt(LocalDateTime.now(clock));
        result.setProcessingTimeMs((System.nanoTime() - startNanos) / 1_000_000);
        return result;
    }

    /**
     * 默认阈值策略：作用于 max(spam, toxicity)
     */
    DecisionAction applyDefaultPolicy(double riskMagnitude) {
        ModerationProperties.Policy policy = properties.getPolicy();
        if (riskMagnitude >= policy.getBlockThreshold()) {
            return DecisionAction.BLOCK;
        } else if (riskMagnitude >= policy.getReviewThreshold()) {
            return DecisionAction.REVIEW;
        } else if (riskMagnitude >= policy.getFlagThreshold()) {
            return DecisionAction.FLAG;
        }
        return DecisionAction.ALLOW;
    }

    private String describeSignals(SignalScores scores) {
        StringBuilder builder = new StringBuilder(String.format(Locale.ROOT, "Automated: spam %.2f, toxicity %.2f",
                scores.getSpam(), scores.getToxicity()));
        if (!scores.getFlags().isEmpty()) {
            builder.append(" ").append(scores.getFlags());
        }
        return builder.toString();
    }
}
