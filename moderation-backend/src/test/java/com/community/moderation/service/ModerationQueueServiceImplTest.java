package com.community.moderation.service;

import com.community.moderation.config.ModerationProperties;
import com.community.moderation.dto.EnqueueCommand;
import com.community.moderation.dto.QueueFilter;
import com.community.moderation.dto.QueueListing;
import com.community.moderation.dto.ResolutionResult;
import com.community.moderation.entity.ContentReport;
import com.community.moderation.entity.ModerationAction;
import com.community.moderation.entity.ModerationQueueItem;
import com.community.moderation.exception.AlreadyResolvedException;
import com.community.moderation.exception.DuplicateActiveException;
import com.community.moderation.exception.NotFoundException;
import com.community.moderation.exception.ValidationException;
import com.community.moderation.model.ContentType;
import com.community.moderation.model.QueueStatus;
import com.community.moderation.model.ReportStatus;
import com.community.moderation.model.ResolutionAction;
import com.community.moderation.model.Severity;
import com.community.moderation.repository.ContentReportRepository;
import com.community.moderation.repository.ModerationActionRepository;
import com.community.moderation.repository.ModerationQueueRepository;
import com.community.moderation.util.ContentLockRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModerationQueueServiceImplTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 4, 9, 30);

    @Mock
    private ModerationQueueRepository queueRepository;

    @Mock
    private ModerationActionRepository actionRepository;

    @Mock
    private ContentReportRepository reportRepository;

    @Mock
    private ReputationService reputationService;

    private ModerationProperties properties;
    private ModerationQueueServiceImpl queueService;

    @BeforeEach
    void setUp() {
        properties = new ModerationProperties();
        Clock clock = Clock.fixed(Instant.parse("2025-03-04T09:30:00Z"), ZoneOffset.UTC);
        TransactionTemplate transactionTemplate = new TransactionTemplate(mock(PlatformTransactionManager.class));
        queueService = new ModerationQueueServiceImpl(queueRepository, actionRepository, reportRepository,
                reputationService, new ReputationAlgorithm(), new ContentLockRegistry(), transactionTemplate,
                properties, clock);
    }

    // --- 入队 ---

    @Test
    void testEnqueue_CreatesPendingItem() {
        when(queueRepository.findFirstByContentIdAndStatusIn("c1", QueueStatus.ACTIVE)).thenReturn(Optional.empty());
        when(queueRepository.save(any(ModerationQueueItem.class))).thenAnswer(inv -> {
            ModerationQueueItem item = inv.getArgument(0);
            item.setId(1L);
            return item;
        });

        ModerationQueueItem item = queueService.enqueue(command("c1", Severity.HIGH));

        assertEquals(1L, item.getId());
        assertEquals(QueueStatus.PENDING, item.getStatus());
        assertEquals(Severity.HIGH, item.getSeverity());
        assertEquals(NOW, item.getCreatedAt());
        assertEquals("rule-x", item.getRuleId());
    }

    // 同一内容最多一个未终结队列项
    @Test
    void testEnqueue_DuplicateActiveRejected() {
        when(queueRepository.findFirstByContentIdAndStatusIn("c1", QueueStatus.ACTIVE))
                .thenReturn(Optional.of(item(9L, "c1", Severity.LOW, QueueStatus.REVIEWING)));

        DuplicateActiveException e = assertThrows(DuplicateActiveException.class,
                () -> queueService.enqueue(command("c1", Severity.HIGH)));

        assertEquals(9L, e.getExistingItemId());
        verify(queueRepository, never()).save(any());
    }

    @Test
    void testEnqueueOrAttach_RaisesSeverityOfActiveItem() {
        ModerationQueueItem existing = item(9L, "c1", Severity.LOW, QueueStatus.PENDING);
        when(queueRepository.findFirstByContentIdAndStatusIn("c1", QueueStatus.ACTIVE)).thenReturn(Optional.of(existing));
        when(queueRepository.save(existing)).thenReturn(existing);

        ModerationQueueItem attached = queueService.enqueueOrAttach(command("c1", Severity.CRITICAL));

        assertSame(existing, attached);
        assertEquals(Severity.CRITICAL, attached.getSeverity());
    }

    @Test
    void testEnqueueOrAttach_LowerSeverityKeepsItem() {
        ModerationQueueItem existing = item(9L, "c1", Severity.HIGH, QueueStatus.PENDING);
        when(queueRepository.findFirstByContentIdAndStatusIn("c1", QueueStatus.ACTIVE)).thenReturn(Optional.of(existing));

        ModerationQueueItem attached = queueService.enqueueOrAttach(command("c1", Severity.LOW));

        assertEquals(Severity.HIGH, attached.getSeverity());
        verify(queueRepository, never()).save(any());
    }

    @Test
    void testEnqueue_InvalidFlagScore() {
        EnqueueCommand command = command("c1", Severity.LOW);
        command.setFlagScore(1.5);

        assertThrows(ValidationException.class, () -> queueService.enqueue(command));
    }

    // --- 列表 ---

    // 严重程度降序，同级按创建时间降序
    @Test
    void testList_OrderAndStats() {
        ModerationQueueItem lowNew = item(1L, "a", Severity.LOW, QueueStatus.PENDING);
        lowNew.setCreatedAt(NOW);
        ModerationQueueItem criticalOld = item(2L, "b", Severity.CRITICAL, QueueStatus.PENDING);
        criticalOld.setCreatedAt(NOW.minusHours(5));
        ModerationQueueItem highNew = item(3L, "c", Severity.HIGH, QueueStatus.PENDING);
        highNew.setCreatedAt(NOW.minusMinutes(1));
        ModerationQueueItem highOld = item(4L, "d", Severity.HIGH, QueueStatus.PENDING);
        highOld.setCreatedAt(NOW.minusHours(2));
        when(queueRepository.search(eq(QueueStatus.PENDING), isNull(), isNull(), any()))
                .thenReturn(Arrays.asList(lowNew, highOld, criticalOld, highNew));
        when(queueRepository.countByStatus(QueueStatus.PENDING)).thenReturn(4L);
        when(queueRepository.countByStatusInAndSeverity(QueueStatus.ACTIVE, Severity.CRITICAL)).thenReturn(1L);
        when(queueRepository.countByStatusInAndAutoFlaggedTrue(QueueStatus.ACTIVE)).thenReturn(3L);

        QueueListing listing = queueService.list(new QueueFilter(QueueStatus.PENDING, null, null), null);

        List<Long> ids = new ArrayList<>();
        for (ModerationQueueItem item : listing.getItems()) {
            ids.add(item.getId());
        }
        assertEquals(Arrays.asList(2L, 3L, 4L, 1L), ids);
        assertEquals(4L, listing.getStats().getTotalPending());
        assertEquals(1L, listing.getStats().getCriticalItems());
        assertEquals(3L, listing.getStats().getAutoFlagged());
    }

    @Test
    void testList_LimitCappedAndValidated() {
        when(queueRepository.search(any(), any(), any(), any())).thenReturn(Collections.emptyList());

        queueService.list(null, 500);

        verify(queueRepository).search(null, null, null, PageRequest.of(0, properties.getQueue().getMaxLimit()));
        assertThrows(ValidationException.class, () -> queueService.list(null, 0));
    }

    // --- 认领 ---

    @Test
    void testClaim_MovesToReviewingAndMarksReports() {
        ModerationQueueItem pending = item(5L, "c5", Severity.MEDIUM, QueueStatus.PENDING);
        ContentReport report = report(50L, "reporter-1", ReportStatus.PENDING);
        when(queueRepository.findById(5L)).thenReturn(Optional.of(pending));
        when(reportRepository.findByQueueItemIdAndStatusIn(eq(5L), any())).thenReturn(Collections.singletonList(report));
        when(queueRepository.save(pending)).thenReturn(pending);

        ModerationQueueItem claimed = queueService.claim(5L, "mod-1");

        assertEquals(QueueStatus.REVIEWING, claimed.getStatus());
        assertEquals("mod-1", claimed.getAssignedModerator());
        assertEquals(ReportStatus.REVIEWING, report.getStatus());
    }

    @Test
    void testClaim_AlreadyClaimedByAnother() {
        ModerationQueueItem reviewing = item(5L, "c5", Severity.MEDIUM, QueueStatus.REVIEWING);
        reviewing.setAssignedModerator("mod-1");
        when(queueRepository.findById(5L)).thenReturn(Optional.of(reviewing));

        assertThrows(AlreadyResolvedException.class, () -> queueService.claim(5L, "mod-2"));
    }

    // --- 处理 ---

    // reject：状态终结、写审计记录、扣作者信誉、采纳举报并奖励举报人
    @Test
    void testResolve_RejectUpdatesReputationAndReports() {
        ModerationQueueItem pending = item(5L, "c5", Severity.HIGH, QueueStatus.PENDING);
        ContentReport report = report(50L, "reporter-1", ReportStatus.REVIEWING);
        when(queueRepository.findById(5L)).thenReturn(Optional.of(pending));
        when(queueRepository.save(pending)).thenReturn(pending);
        when(actionRepository.save(any(ModerationAction.class))).thenAnswer(inv -> inv.getArgument(0));
        when(reportRepository.findByQueueItemIdAndStatusIn(5L, ReportStatus.OPEN))
                .thenReturn(Collections.singletonList(report));

        ResolutionResult result = queueService.resolve(5L, "mod-1", ResolutionAction.REJECT, "spam");

        assertEquals(QueueStatus.REJECTED, result.getItem().getStatus());
        assertEquals(ResolutionAction.REJECT, result.getItem().getActionTaken());
        assertEquals(NOW, result.getItem().getProcessedAt());
        assertEquals("reject", result.getAction().getActionType());
        assertEquals("mod-1", result.getAction().getModeratorId());
        assertEquals(1, result.getReportsResolved());
        assertEquals(ReportStatus.RESOLVED, report.getStatus());
        assertEquals("upheld:reject", report.getResolution());
        verify(reputationService).applyDelta(eq("author-1"), any());
        verify(reputationService).applyDelta(eq("reporter-1"), any());
    }

    // approve：举报被驳回，不奖励举报人
    @Test
    void testResolve_ApproveDismissesReports() {
        ModerationQueueItem pending = item(5L, "c5", Severity.LOW, QueueStatus.REVIEWING);
        ContentReport report = report(50L, "reporter-1", ReportStatus.REVIEWING);
        when(queueRepository.findById(5L)).thenReturn(Optional.of(pending));
        when(queueRepository.save(pending)).thenReturn(pending);
        when(actionRepository.save(any(ModerationAction.class))).thenAnswer(inv -> inv.getArgument(0));
        when(reportRepository.findByQueueItemIdAndStatusIn(5L, ReportStatus.OPEN))
                .thenReturn(Collections.singletonList(report));

        ResolutionResult result = queueService.resolve(5L, "mod-1", ResolutionAction.APPROVE, null);

        assertEquals(QueueStatus.APPROVED, result.getItem().getStatus());
        assertEquals(ContentReport.RESOLUTION_DISMISSED, report.getResolution());
        verify(reputationService).applyDelta(eq("author-1"), any());
        verify(reputationService, never()).applyDelta(eq("reporter-1"), any());
    }

    // 已终结的队列项不能再次处理，也不会再改动信誉
    @Test
    void testResolve_AlreadyResolved() {
        ModerationQueueItem rejected = item(5L, "c5", Severity.HIGH, QueueStatus.REJECTED);
        when(queueRepository.findById(5L)).thenReturn(Optional.of(rejected));

        assertThrows(AlreadyResolvedException.class,
                () -> queueService.resolve(5L, "mod-2", ResolutionAction.BAN, null));
        verify(reputationService, never()).applyDelta(anyString(), any());
        verify(actionRepository, never()).save(any());
    }

    @Test
    void testResolve_NotFound() {
        when(queueRepository.findById(404L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> queueService.resolve(404L, "mod-1", ResolutionAction.REJECT, null));
    }

    @Test
    void testResolve_MissingAction() {
        assertThrows(ValidationException.class, () -> queueService.resolve(5L, "mod-1", null, null));
    }

    @Test
    void testResolve_WithoutAuthorSkipsReputation() {
        ModerationQueueItem pending = item(5L, "c5", Severity.HIGH, QueueStatus.PENDING);
        pending.setAuthorId(null);
        when(queueRepository.findById(5L)).thenReturn(Optional.of(pending));
        when(queueRepository.save(pending)).thenReturn(pending);
        when(actionRepository.save(any(ModerationAction.class))).thenAnswer(inv -> inv.getArgument(0));
        when(reportRepository.findByQueueItemIdAndStatusIn(5L, ReportStatus.OPEN)).thenReturn(Collections.emptyList());

        queueService.resolve(5L, "mod-1", ResolutionAction.WARN, "tone");

        ArgumentCaptor<ModerationAction> captor = ArgumentCaptor.forClass(ModerationAction.class);
        verify(actionRepository).save(captor.capture());
        assertEquals("tone", captor.getValue().getReason());
        verify(reputationService, never()).applyDelta(anyString(), any());
        assertTrue(pending.getStatus().isTerminal());
    }

    private static EnqueueCommand command(String contentId, Severity severity) {
        return new EnqueueCommand(contentId, ContentType.FORUM_POST, "author-1", "Automated flag", severity, true, 0.7,
                null, 3L, "rule-x");
    }

    private static ModerationQueueItem item(Long id, String contentId, Severity severity, QueueStatus status) {
        ModerationQueueItem item = new ModerationQueueItem();
        item.setId(id);
        item.setContentId(contentId);
        item.setContentType(ContentType.FORUM_POST);
        item.setAuthorId("author-1");
        item.setReason("Automated flag");
        item.setSeverity(severity);
        item.setStatus(status);
        item.setCreatedAt(NOW.minusHours(1));
        return item;
    }

    private static ContentReport report(Long id, String reporterId, ReportStatus status) {
        ContentReport report = new ContentReport();
        report.setId(id);
        report.setContentId("c5");
        report.setReporterId(reporterId);
        report.setStatus(status);
        report.setQueueItemId(5L);
        return report;
    }
}
