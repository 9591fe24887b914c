package com.community.moderation.controller;

import com.community.moderation.dto.CommonResponse;
import com.community.moderation.dto.ReputationDTO;
import com.community.moderation.exception.ForbiddenException;
import com.community.moderation.model.RequestPrincipal;
import com.community.moderation.service.ReputationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/moderation/reputation")
public class ReputationController {

    private final ReputationService reputationService;

    public ReputationController(ReputationService reputationService) {
        this.reputationService = reputationService;
    }

    /**
     * 用户可查看自己的信誉，审核员可查看任意用户
     */
    @GetMapping("/{userId}")
    public ResponseEntity<CommonResponse<ReputationDTO>> getReputation(RequestPrincipal principal,
                                                                       @PathVariable String userId) {
        if (!principal.isPrivileged() && !principal.getUserId().equals(userId)) {
            throw new ForbiddenException("Cannot view another user's reputation");
        }
        return ResponseEntity.ok(CommonResponse.success(reputationService.getReputation(userId)));
    }
}
