package com.community.moderation.controller;

import com.community.moderation.dto.CommonResponse;
import com.community.moderation.dto.EvaluateRequest;
import com.community.moderation.dto.ModerationResult;
import com.community.moderation.dto.QueueFilter;
import com.community.moderation.dto.QueueListing;
import com.community.moderation.dto.ResolutionResult;
import com.community.moderation.dto.ResolveRequest;
import com.community.moderation.entity.ModerationDecision;
import com.community.moderation.entity.ModerationQueueItem;
import com.community.moderation.model.ContentType;
import com.community.moderation.model.QueueStatus;
import com.community.moderation.model.RequestPrincipal;
import com.community.moderation.model.Severity;
import com.community.moderation.service.ContentModerationService;
import com.community.moderation.service.ModerationQueueService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/moderation")
public class ModerationController {

    // 查询全部状态
    private static final String ALL_STATUSES = "all";

    private final ContentModerationService moderationService;
    private final ModerationQueueService queueService;

    public ModerationController(ContentModerationService moderationService, ModerationQueueService queueService) {
        this.moderationService = moderationService;
        this.queueService = queueService;
    }

    /**
     * 评估内容。调用方即内容作者；analyzeOnly=true 时不入队、不落库。
     */
    @PostMapping("/evaluate")
    public ResponseEntity<CommonResponse<ModerationResult>> evaluate(RequestPrincipal principal,
                                                                     @Valid @RequestBody EvaluateRequest request) {
        ModerationResult result = moderationService.evaluate(request, principal.getUserId());
        if (result.isDegraded()) {
            return ResponseEntity.ok(CommonResponse.degraded(result, result.getReason()));
        }
        return ResponseEntity.ok(CommonResponse.success(result));
    }

    @GetMapping("/decisions/{contentId}")
    public ResponseEntity<CommonResponse<List<ModerationDecision>>> getDecisions(RequestPrincipal principal,
                                                                                 @PathVariable String contentId) {
        principal.requirePrivileged();
        return ResponseEntity.ok(CommonResponse.success(moderationService.history(contentId)));
    }

    @GetMapping("/queue")
    public ResponseEntity<CommonResponse<QueueListing>> getQueue(RequestPrincipal principal,
                                                                 @RequestParam(required = false, defaultValue = "pending") String status,
                                                                 @RequestParam(required = false) String severity,
                                                                 @RequestParam(required = false) String contentType,
                                                                 @RequestParam(required = false) Integer limit) {
        principal.requirePrivileged();
        QueueFilter filter = new QueueFilter(
                ALL_STATUSES.equalsIgnoreCase(status) ? null : QueueStatus.fromCode(status),
                severity == null ? null : Severity.fromCode(severity),
                contentType == null ? null : ContentType.fromCode(contentType));
        return ResponseEntity.ok(CommonResponse.success(queueService.list(filter, limit)));
    }

    @GetMapping("/queue/{queueItemId}")
    public ResponseEntity<CommonResponse<ModerationQueueItem>> getQueueItem(RequestPrincipal principal,
                                                                            @PathVariable Long queueItemId) {
        principal.requirePrivileged();
        return ResponseEntity.ok(CommonResponse.success(queueService.getItem(queueItemId)));
    }

    @PatchMapping("/queue")
    public ResponseEntity<CommonResponse<ResolutionResult>> resolve(RequestPrincipal principal,
                                                                    @Valid @RequestBody ResolveRequest request) {
        principal.requirePrivileged();
        ResolutionResult result = queueService.resolve(request.getQueueItemId(), principal.getUserId(),
                request.getAction(), request.getModeratorNotes());
        return ResponseEntity.ok(CommonResponse.success(result, "Queue item resolved: " + request.getAction().getCode()));
    }

    @PostMapping("/queue/{queueItemId}/claim")
    public ResponseEntity<CommonResponse<ModerationQueueItem>> claim(RequestPrincipal principal,
                                                                     @PathVariable Long queueItemId) {
        principal.requirePrivileged();
        return ResponseEntity.ok(CommonResponse.success(queueService.claim(queueItemId, principal.getUserId())));
    }
}
