package com.community.moderation.controller;

import com.community.moderation.dto.CommonResponse;
import com.community.moderation.dto.FeedbackConsensus;
import com.community.moderation.dto.FeedbackRequest;
import com.community.moderation.dto.FeedbackSubmission;
import com.community.moderation.model.RequestPrincipal;
import com.community.moderation.service.CommunityFeedbackService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/moderation/feedback")
public class FeedbackController {

    private final CommunityFeedbackService feedbackService;

    public FeedbackController(CommunityFeedbackService feedbackService) {
        this.feedbackService = feedbackService;
    }

    @PostMapping
    public ResponseEntity<CommonResponse<FeedbackSubmission>> submit(RequestPrincipal principal,
                                                                     @Valid @RequestBody FeedbackRequest request) {
        FeedbackSubmission submission = feedbackService.submitVote(request.getQueueItemId(), principal.getUserId(),
                request.getWasAccurate(), request.getSeverityRating());
        String message = submission.isOverwritten() ? "Feedback updated" : "Thank you for your feedback";
        return ResponseEntity.ok(CommonResponse.success(submission, message));
    }

    @GetMapping("/{queueItemId}")
    public ResponseEntity<CommonResponse<FeedbackConsensus>> consensus(RequestPrincipal principal,
                                                                       @PathVariable Long queueItemId) {
        return ResponseEntity.ok(CommonResponse.success(feedbackService.getConsensus(queueItemId)));
    }
}
