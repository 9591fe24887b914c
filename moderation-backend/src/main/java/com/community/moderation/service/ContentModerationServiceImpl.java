package com.community.moderation.service;

import com.community.moderation.dto.EnqueueCommand;
import com.community.moderation.dto.EvaluateRequest;
import com.community.moderation.dto.ModerationResult;
import com.community.moderation.entity.ModerationAction;
import com.community.moderation.entity.ModerationDecision;
import com.community.moderation.entity.ModerationQueueItem;
import com.community.moderation.exception.ScorerUnavailableException;
import com.community.moderation.model.DecisionAction;
import com.community.moderation.model.EvaluationContext;
import com.community.moderation.model.ReputationSnapshot;
import com.community.moderation.model.Severity;
import com.community.moderation.repository.ModerationActionRepository;
import com.community.moderation.repository.ModerationDecisionRepository;
import com.community.moderation.rule.RuleActionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

/**
 * 内容审核入口：调用决策引擎，持久化结果，按需入队。
 * 队列写入使用自己的事务，此处不开启外层事务。
 */
@Service
public class ContentModerationServiceImpl implements ContentModerationService {

    private static final Logger log = LoggerFactory.getLogger(ContentModerationServiceImpl.class);

    static final String SCORER_UNAVAILABLE_REASON = "Signal scorer unavailable; escalated to review";

    private final DecisionEngine decisionEngine;
    private final ReputationService reputationService;
    private final ModerationQueueService queueService;
    private final ModerationDecisionRepository decisionRepository;
    private final ModerationActionRepository actionRepository;
    private final Clock clock;

    public ContentModerationServiceImpl(DecisionEngine decisionEngine,
                                        ReputationService reputationService,
                                        ModerationQueueService queueService,
                                        ModerationDecisionRepository decisionRepository,
                                        ModerationActionRepository actionRepository,
                                        Clock clock) {
        this.decisionEngine = decisionEngine;
        this.reputationService = reputationService;
        this.queueService = queueService;
        this.decisionRepository = decisionRepository;
        this.actionRepository = actionRepository;
        this.clock = clock;
    }

    @Override
    public ModerationResult evaluate(EvaluateRequest request, String authorId) {
        EvaluationContext context = new EvaluationContext(request.getContentType(), LocalDateTime.now(clock),
                request.getContextFlags() == null ? new LinkedHashSet<>() : new LinkedHashSet<>(request.getContextFlags()));

        ModerationResult result;
        try {
            result = decisionEngine.evaluate(request.getContentId(), request.getContent(), authorId, context);
        } catch (ScorerUnavailableException e) {
            log.warn("内容 {} 打分失败，降级为 review: {}", request.getContentId(), e.getMessage());
            result = degradedResult(request, authorId);
        }

        if (request.isAnalyzeOnly()) {
            return result;
        }

        try {
            persist(result);
        } catch (DataAccessException e) {
            log.error("内容 {} 的审核结果持久化失败", request.getContentId(), e);
            result.setDegraded(true);
        }
        return result;
    }

    @Override
    public List<ModerationDecision> history(String contentId) {
        return decisionRepository.findByContentIdOrderByComputedAtDesc(contentId);
    }

    private void persist(ModerationResult result) {
        // --- 1. 审核结果 ---
        ModerationDecision decision = decisionRepository.save(toEntity(result));

        // --- 2. 自动 block 记为自动化动作 ---
        if (result.getAction() == DecisionAction.BLOCK) {
            ModerationAction automated = new ModerationAction();
            automated.setContentId(result.getContentId());
            automated.setContentType(result.getContentType());
            automated.setActionType(DecisionAction.BLOCK.getCode());
            automated.setModeratorId(ModerationAction.SYSTEM_MODERATOR);
            automated.setReason(result.getReason());
            automated.setAutomated(true);
            automated.setCreatedAt(result.getComputedAt());
            actionRepository.save(automated);
        }

        if (result.getSideEffects().contains(RuleActionType.NOTIFY.getCode())) {
            log.warn("规则 {} 要求通知审核员: 内容 {} ({}, {})", result.getWinningRuleId(), result.getContentId(),
                    result.getAction().getCode(), result.getSeverity().getCode());
        }

        // --- 3. 入队（trusted 及以上的低严重度 flag 跳过） ---
        if (!result.isShouldFlag() || result.isQueueBypassed()) {
            return;
        }
        Severity severity = result.getSideEffects().contains(RuleActionType.ESCALATE.getCode())
                ? Severity.CRITICAL
                : result.getSeverity();
        double flagScore = result.getAdjustedScores() == null ? 0.0
                : Math.max(result.getAdjustedScores().getSpam(), result.getAdjustedScores().getToxicity());
        ModerationQueueItem item = queueService.enqueueOrAttach(new EnqueueCommand(result.getContentId(),
                result.getContentType(), result.getAuthorId(), truncate(result.getReason()), severity, true,
                flagScore, null, decision.getDecisionId(), result.getWinningRuleId()));

        result.setQueueItemId(item.getId());
        decision.setQueueItemId(item.getId());
        decisionRepository.save(decision);
    }

    private ModerationResult degradedResult(EvaluateRequest request, String authorId) {
        ReputationSnapshot reputation = reputationService.getSnapshot(authorId);
        ModerationResult result = new ModerationResult();
        result.setEvaluationId(UUID.randomUUID().toString());
        result.setContentId(request.getContentId());
        result.setContentType(request.getContentType());
        result.setAuthorId(authorId);
        result.setAction(DecisionAction.REVIEW);
        result.setShouldFlag(true);
        result.setSeverity(Severity.MEDIUM);
        result.setConfidence(0.0);
        result.setReason(SCORER_UNAVAILABLE_REASON);
        result.setAuthorTier(reputation.getTrustTier());
        result.setAuthorScore(reputation.getOverallScore());
        result.setDegraded(true);
        result.setComputedAt(LocalDateTime.now(clock));
        return result;
    }

    private ModerationDecision toEntity(ModerationResult result) {
        ModerationDecision decision = new ModerationDecision();
        decision.setEvaluationId(result.getEvaluationId());
        decision.setContentId(result.getContentId());
        decision.setContentType(result.getContentType());
        decision.setAuthorId(result.getAuthorId());
        decision.setAuthorTier(result.getAuthorTier());
        decision.setAuthorScore(result.getAuthorScore());
        if (result.getScores() != null) {
            decision.setSpamScore(result.getScores().getSpam());
            decision.setToxicityScore(result.getScores().getToxicity());
            decision.setQualityScore(result.getScores().getQuality());
            decision.setCulturalAdjustment(result.getScores().getCulturalAdjustment());
        }
        if (result.getAdjustedScores() != null) {
            decision.setAdjustedSpam(result.getAdjustedScores().getSpam());
            decision.setAdjustedToxicity(result.getAdjustedScores().getToxicity());
        }
        decision.setSignalFlags(new ArrayList<>(result.getFlags()));
        decision.setShouldFlag(result.isShouldFlag());
        decision.setSeverity(result.getSeverity());
        decision.setAction(result.getAction());
        decision.setConfidence(result.getConfidence());
        decision.setTriggeredRuleIds(new ArrayList<>(result.getRuleIdsTriggered()));
        decision.setWinningRuleId(result.getWinningRuleId());
        decision.setDegraded(result.isDegraded());
        decision.setQueueBypassed(result.isQueueBypassed());
        decision.setProcessingTimeMs(result.getProcessingTimeMs());
        decision.setComputedAt(result.getComputedAt());
        return decision;
    }

    private String truncate(String reason) {
        if (reason == null) {
            return "Automated flag";
        }
        return reason.length() > 500 ? reason.substring(0, 500) : reason;
    }
}
