package com.community.moderation.service;

import com.community.moderation.config.ModerationProperties;
import com.community.moderation.dto.EnqueueCommand;
import com.community.moderation.dto.ReportRequest;
import com.community.moderation.entity.ContentReport;
import com.community.moderation.entity.ModerationDecision;
import com.community.moderation.entity.ModerationQueueItem;
import com.community.moderation.exception.ConflictException;
import com.community.moderation.exception.ValidationException;
import com.community.moderation.model.ReportPriority;
import com.community.moderation.model.ReportStatus;
import com.community.moderation.model.RequestPrincipal;
import com.community.moderation.repository.ContentReportRepository;
import com.community.moderation.repository.ModerationDecisionRepository;
import com.community.moderation.util.ContentLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class ContentReportServiceImpl implements ContentReportService {

    private static final Logger log = LoggerFactory.getLogger(ContentReportServiceImpl.class);

    private final ContentReportRepository reportRepository;
    private final ModerationDecisionRepository decisionRepository;
    private final ModerationQueueService queueService;
    private final ContentLockRegistry lockRegistry;
    private final TransactionTemplate transactionTemplate;
    private final ModerationProperties properties;
    private final Clock clock;

    public ContentReportServiceImpl(ContentReportRepository reportRepository,
                                    ModerationDecisionRepository decisionRepository,
                                    ModerationQueueService queueService,
                                    ContentLockRegistry lockRegistry,
                                    TransactionTemplate transactionTemplate,
                                    ModerationProperties properties,
                                    Clock clock) {
        this.reportRepository = reportRepository;
        this.decisionRepository = decisionRepository;
        this.queueService = queueService;
        this.lockRegistry = lockRegistry;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public ContentReport createReport(ReportRequest request, String reporterId) {
        // 与队列写操作共用同一把内容锁，避免同一举报人并发重复提交；
        // 队列项与举报在同一事务内写入，举报保存失败时队列项一并回滚
        return lockRegistry.withLock(request.getContentId(), () -> transactionTemplate.execute(status -> {
            if (reportRepository.existsByContentIdAndReporterIdAndStatusIn(
                    request.getContentId(), reporterId, ReportStatus.OPEN)) {
                throw ConflictException.duplicateReport(request.getContentId());
            }

            ReportPriority priority = request.getCategory().derivePriority();
            Optional<ModerationDecision> latestDecision =
                    decisionRepository.findFirstByContentIdOrderByComputedAtDesc(request.getContentId());
            String authorId = request.getAuthorId() != null
                    ? request.getAuthorId()
                    : latestDecision.map(ModerationDecision::getAuthorId).orElse(null);

            // --- 1. 关联或新建队列项 ---
            ModerationQueueItem item = queueService.enqueueOrAttach(new EnqueueCommand(
                    request.getContentId(),
                    request.getContentType(),
                    authorId,
                    "User report: " + request.getCategory().getCode() + " - " + request.getReason(),
                    priority.getQueueSeverity(),
                    false,
                    0.0,
                    reporterId,
                    latestDecision.map(ModerationDecision::getDecisionId).orElse(null),
                    latestDecision.map(ModerationDecision::getWinningRuleId).orElse(null)));

            // --- 2. 保存举报 ---
            ContentReport report = new ContentReport();
            report.setContentId(request.getContentId());
            report.setContentType(request.getContentType());
            report.setReporterId(reporterId);
            report.setCategory(request.getCategory());
            report.setReason(request.getReason());
            report.setDescription(request.getDescription());
            report.setEvidenceUrls(request.getEvidenceUrls() == null
                    ? new ArrayList<>() : new ArrayList<>(request.getEvidenceUrls()));
            report.setPriority(priority);
            report.setStatus(ReportStatus.PENDING);
            report.setQueueItemId(item.getId());
            report.setCreatedAt(LocalDateTime.now(clock));
            ContentReport saved = reportRepository.save(report);

            log.info("用户 {} 举报内容 {} ({}, priority={})，关联队列项 {}",
                    reporterId, request.getContentId(), request.getCategory().getCode(), priority.getCode(), item.getId());
            return saved;
        }));
    }

    @Override
    public List<ContentReport> listReports(RequestPrincipal principal, ReportStatus status, Integer limit) {
        Pageable page = PageRequest.of(0, normalizeLimit(limit));
        if (principal.isPrivileged()) {
            return status == null
                    ? reportRepository.findAllByOrderByCreatedAtDesc(page)
                    : reportRepository.findByStatusOrderByCreatedAtDesc(status, page);
        }
        return status == null
                ? reportRepository.findByReporterIdOrderByCreatedAtDesc(principal.getUserId(), page)
                : reportRepository.findByReporterIdAndStatusOrderByCreatedAtDesc(principal.getUserId(), status, page);
    }

    private int normalizeLimit(Integer limit) {
        if (limit == null) {
            return properties.getQueue().getDefaultLimit();
        }
        if (limit < 1) {
            throw new ValidationException("limit must be positive");
        }
        return Math.min(limit, properties.getQueue().getMaxLimit());
    }
}
