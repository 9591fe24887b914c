package com.community.moderation.service;

import com.community.moderation.config.ModerationProperties;
import com.community.moderation.dto.EnqueueCommand;
import com.community.moderation.dto.QueueFilter;
import com.community.moderation.dto.QueueListing;
import com.community.moderation.dto.QueueStats;
import com.community.moderation.dto.ResolutionResult;
import com.community.moderation.entity.ContentReport;
import com.community.moderation.entity.ModerationAction;
import com.community.moderation.entity.ModerationQueueItem;
import com.community.moderation.exception.AlreadyResolvedException;
import com.community.moderation.exception.DuplicateActiveException;
import com.community.moderation.exception.NotFoundException;
import com.community.moderation.exception.ValidationException;
import com.community.moderation.model.QueueStatus;
import com.community.moderation.model.ReportStatus;
import com.community.moderation.model.ResolutionAction;
import com.community.moderation.model.Severity;
import com.community.moderation.repository.ContentReportRepository;
import com.community.moderation.repository.ModerationActionRepository;
import com.community.moderation.repository.ModerationQueueRepository;
import com.community.moderation.util.ContentLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
public class ModerationQueueServiceImpl implements ModerationQueueService {

    private static final Logger log = LoggerFactory.getLogger(ModerationQueueServiceImpl.class);

    /**
     * 队列展示顺序：严重程度降序，其次创建时间降序（id 兜底保证稳定）
     */
    public static final Comparator<ModerationQueueItem> QUEUE_ORDER = Comparator
            .comparingInt((ModerationQueueItem item) -> item.getSeverity().getRank()).reversed()
            .thenComparing(ModerationQueueItem::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(ModerationQueueItem::getId, Comparator.nullsLast(Comparator.reverseOrder()));

    // 乐观锁冲突（多实例部署）时的重试次数
    private static final int MAX_RESOLVE_ATTEMPTS = 3;

    private final ModerationQueueRepository queueRepository;
    private final ModerationActionRepository actionRepository;
    private final ContentReportRepository reportRepository;
    private final ReputationService reputationService;
    private final ReputationAlgorithm reputationAlgorithm;
    private final ContentLockRegistry lockRegistry;
    private final TransactionTemplate transactionTemplate;
    private final ModerationProperties properties;
    private final Clock clock;

    public ModerationQueueServiceImpl(ModerationQueueRepository queueRepository,
                                      ModerationActionRepository actionRepository,
                                      ContentReportRepository reportRepository,
                                      ReputationService reputationService,
                                      ReputationAlgorithm reputationAlgorithm,
                                      ContentLockRegistry lockRegistry,
                                      TransactionTemplate transactionTemplate,
                                      ModerationProperties properties,
                                      Clock clock) {
        this.queueRepository = queueRepository;
        this.actionRepository = actionRepository;
        this.reportRepository = reportRepository;
        this.reputationService = reputationService;
        this.reputationAlgorithm = reputationAlgorithm;
        this.lockRegistry = lockRegistry;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public ModerationQueueItem enqueue(EnqueueCommand command) {
        validate(command);
        return lockRegistry.withLock(command.getContentId(), () -> transactionTemplate.execute(status -> {
            Optional<ModerationQueueItem> active = queueRepository
                    .findFirstByContentIdAndStatusIn(command.getContentId(), QueueStatus.ACTIVE);
            if (active.isPresent()) {
                throw new DuplicateActiveException(command.getContentId(), active.get().getId());
            }
            return createItem(command);
        }));
    }

    @Override
    public ModerationQueueItem enqueueOrAttach(EnqueueCommand command) {
        validate(command);
        return lockRegistry.withLock(command.getContentId(), () -> transactionTemplate.execute(status -> {
            Optional<ModerationQueueItem> active = queueRepository
                    .findFirstByContentIdAndStatusIn(command.getContentId(), QueueStatus.ACTIVE);
            if (active.isEmpty()) {
                return createItem(command);
            }
            ModerationQueueItem existing = active.get();
            boolean changed = false;
            if (command.getSeverity().getRank() > existing.getSeverity().getRank()) {
                log.info("队列项 {} 严重程度提升: {} -> {}", existing.getId(), existing.getSeverity(), command.getSeverity());
                existing.setSeverity(command.getSeverity());
                changed = true;
            }
            if (existing.getAuthorId() == null && command.getAuthorId() != null) {
                existing.setAuthorId(command.getAuthorId());
                changed = true;
            }
            return changed ? queueRepository.save(existing) : existing;
        }));
    }

    @Override
    public QueueListing list(QueueFilter filter, Integer limit) {
        QueueFilter criteria = filter == null ? new QueueFilter() : filter;
        int pageSize = normalizeLimit(limit);

        List<ModerationQueueItem> items = new ArrayList<>(queueRepository.search(
                criteria.getStatus(), criteria.getSeverity(), criteria.getContentType(), PageRequest.of(0, pageSize)));
        items.sort(QUEUE_ORDER);

        QueueStats stats = new QueueStats(
                queueRepository.countByStatus(QueueStatus.PENDING),
                queueRepository.countByStatusInAndSeverity(QueueStatus.ACTIVE, Severity.CRITICAL),
                queueRepository.countByStatusInAndAutoFlaggedTrue(QueueStatus.ACTIVE));
        return new QueueListing(items, stats);
    }

    @Override
    public ModerationQueueItem getItem(Long queueItemId) {
        return queueRepository.findById(queueItemId)
                .orElseThrow(() -> new NotFoundException("Queue item not found: " + queueItemId));
    }

    @Override
    public ModerationQueueItem claim(Long queueItemId, String moderatorId) {
        ModerationQueueItem item = getItem(queueItemId);
        return lockRegistry.withLock(item.getContentId(), () -> transactionTemplate.execute(status -> {
            ModerationQueueItem current = getItem(queueItemId);
            if (current.getStatus().isTerminal()) {
                throw new AlreadyResolvedException("Queue item " + queueItemId + " is already " + current.getStatus().getCode());
            }
            if (current.getStatus() == QueueStatus.REVIEWING && !moderatorId.equals(current.getAssignedModerator())) {
                throw new AlreadyResolvedException("Queue item " + queueItemId + " is already claimed by "
                        + current.getAssignedModerator());
            }
            current.setStatus(QueueStatus.REVIEWING);
            current.setAssignedModerator(moderatorId);

            List<ContentReport> reports = reportRepository.findByQueueItemIdAndStatusIn(queueItemId,
                    List.of(ReportStatus.PENDING));
            for (ContentReport report : reports) {
                report.setStatus(ReportStatus.REVIEWING);
            }
            if (!reports.isEmpty()) {
                reportRepository.saveAll(reports);
            }
            log.info("审核员 {} 认领队列项 {}", moderatorId, queueItemId);
            return queueRepository.save(current);
        }));
    }

    @Override
    public ResolutionResult resolve(Long queueItemId, String moderatorId, ResolutionAction action, String notes) {
        if (action == null) {
            throw new ValidationException("Action is required");
        }
        ModerationQueueItem item = getItem(queueItemId);
        if (item.getStatus().isTerminal()) {
            throw new AlreadyResolvedException("Queue item " + queueItemId + " is already " + item.getStatus().getCode());
        }

        OptimisticLockingFailureException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_RESOLVE_ATTEMPTS; attempt++) {
            try {
                return lockRegistry.withLock(item.getContentId(), () -> transactionTemplate.execute(
                        status -> doResolve(queueItemId, moderatorId, action, notes)));
            } catch (OptimisticLockingFailureException e) {
                lastConflict = e;
                log.warn("处理队列项 {} 时发生并发冲突，第 {} 次重试", queueItemId, attempt);
            }
        }
        throw lastConflict;
    }

    // --- 事务内执行 ---

    private ResolutionResult doResolve(Long queueItemId, String moderatorId, ResolutionAction action, String notes) {
        ModerationQueueItem current = getItem(queueItemId);
        if (current.getStatus().isTerminal()) {
            throw new AlreadyResolvedException("Queue item " + queueItemId + " is already " + current.getStatus().getCode());
        }
        LocalDateTime now = LocalDateTime.now(clock);

        // --- 1. 状态迁移 ---
        current.setStatus(action.resultingStatus());
        current.setActionTaken(action);
        current.setModeratorNotes(notes);
        current.setAssignedModerator(moderatorId);
        current.setProcessedAt(now);
        ModerationQueueItem saved = queueRepository.save(current);

        // --- 2. 审计记录 ---
        ModerationAction audit = new ModerationAction();
        audit.setQueueItemId(saved.getId());
        audit.setContentId(saved.getContentId());
        audit.setContentType(saved.getContentType());
        audit.setActionType(action.getCode());
        audit.setModeratorId(moderatorId);
        audit.setReason(notes != null ? notes : saved.getReason());
        audit.setAutomated(false);
        audit.setCreatedAt(now);
        ModerationAction savedRecord = actionRepository.save(audit);

        // --- 3. 作者信誉 ---
        if (saved.getAuthorId() != null) {
            reputationService.applyDelta(saved.getAuthorId(),
                    reputationAlgorithm.resolutionDelta(action, saved.getSeverity()));
        } else {
            log.warn("队列项 {} 没有作者信息，跳过信誉更新", saved.getId());
        }

        // --- 4. 关联举报结案，采纳的举报奖励举报人 ---
        List<ContentReport> reports = reportRepository.findByQueueItemIdAndStatusIn(saved.getId(), ReportStatus.OPEN);
        Set<String> rewardedReporters = new LinkedHashSet<>();
        for (ContentReport report : reports) {
            report.setStatus(ReportStatus.RESOLVED);
            report.setResolvedBy(moderatorId);
            report.setResolution(action == ResolutionAction.APPROVE
                    ? ContentReport.RESOLUTION_DISMISSED
                    : ContentReport.RESOLUTION_UPHELD_PREFIX + action.getCode());
            report.setResolvedAt(now);
            if (action != ResolutionAction.APPROVE) {
                rewardedReporters.add(report.getReporterId());
            }
        }
        if (!reports.isEmpty()) {
            reportRepository.saveAll(reports);
        }
        for (String reporterId : rewardedReporters) {
            reputationService.applyDelta(reporterId, reputationAlgorithm.reporterReward());
        }

        log.info("队列项 {} 已由 {} 处理: {} -> {}", saved.getId(), moderatorId, action.getCode(), saved.getStatus().getCode());
        return new ResolutionResult(saved, savedRecord, reports.size());
    }

    private ModerationQueueItem createItem(EnqueueCommand command) {
        ModerationQueueItem item = new ModerationQueueItem();
        item.setContentId(command.getContentId());
        item.setContentType(command.getContentType());
        item.setAuthorId(command.getAuthorId());
        item.setReason(command.getReason());
        item.setSeverity(command.getSeverity());
        item.setStatus(QueueStatus.PENDING);
        item.setAutoFlagged(command.isAutoFlagged());
        item.setFlagScore(command.getFlagScore());
        item.setReportedBy(command.getReporterId());
        item.setDecisionId(command.getDecisionId());
        item.setRuleId(command.getRuleId());
        item.setCreatedAt(LocalDateTime.now(clock));
        ModerationQueueItem saved = queueRepository.save(item);
        log.info("内容 {} 进入审核队列 (id={}, severity={}, auto={})",
                saved.getContentId(), saved.getId(), saved.getSeverity().getCode(), saved.isAutoFlagged());
        return saved;
    }

    private void validate(EnqueueCommand command) {
        if (command == null || command.getContentId() == null || command.getContentId().isBlank()) {
            throw new ValidationException("contentId is required");
        }
        if (command.getContentType() == null) {
            throw new ValidationException("contentType is required");
        }
        if (command.getSeverity() == null) {
            throw new ValidationException("severity is required");
        }
        if (command.getReason() == null || command.getReason().isBlank()) {
            throw new ValidationException("reason is required");
        }
        if (command.getFlagScore() < 0.0 || command.getFlagScore() > 1.0) {
            throw new ValidationException("flagScore must be between 0 and 1");
        }
    }

    private int normalizeLimit(Integer limit) {
        ModerationProperties.Queue queue = properties.getQueue();
        if (limit == null) {
            return queue.getDefaultLimit();
        }
        if (limit < 1) {
            throw new ValidationException("limit must be positive");
        }
        return Math.min(limit, queue.getMaxLimit());
    }
}
