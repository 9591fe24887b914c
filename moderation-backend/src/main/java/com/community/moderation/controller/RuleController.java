package com.community.moderation.controller;

import com.community.moderation.dto.CommonResponse;
import com.community.moderation.dto.RuleActivationRequest;
import com.community.moderation.dto.RuleRequest;
import com.community.moderation.entity.ModerationRule;
import com.community.moderation.model.RequestPrincipal;
import com.community.moderation.service.RuleService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 规则管理，修改后规则引擎立即重载
 */
@RestController
@RequestMapping("/moderation/rules")
public class RuleController {

    private final RuleService ruleService;

    public RuleController(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @GetMapping
    public ResponseEntity<CommonResponse<List<ModerationRule>>> listRules(RequestPrincipal principal) {
        principal.requirePrivileged();
        return ResponseEntity.ok(CommonResponse.success(ruleService.listRules()));
    }

    @GetMapping("/{ruleId}")
    public ResponseEntity<CommonResponse<ModerationRule>> getRule(RequestPrincipal principal,
                                                                  @PathVariable String ruleId) {
        principal.requirePrivileged();
        return ResponseEntity.ok(CommonResponse.success(ruleService.getRule(ruleId)));
    }

    @PostMapping
    public ResponseEntity<CommonResponse<ModerationRule>> createRule(RequestPrincipal principal,
                                                                     @Valid @RequestBody RuleRequest request) {
        principal.requirePrivileged();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommonResponse.success(ruleService.createRule(request), "Rule created"));
    }

    @PutMapping("/{ruleId}")
    public ResponseEntity<CommonResponse<ModerationRule>> updateRule(RequestPrincipal principal,
                                                                     @PathVariable String ruleId,
                                                                     @Valid @RequestBody RuleRequest request) {
        principal.requirePrivileged();
        return ResponseEntity.ok(CommonResponse.success(ruleService.updateRule(ruleId, request), "Rule updated"));
    }

    @PatchMapping("/{ruleId}/active")
    public ResponseEntity<CommonResponse<ModerationRule>> setActive(RequestPrincipal principal,
                                                                    @PathVariable String ruleId,
                                                                    @Valid @RequestBody RuleActivationRequest request) {
        principal.requirePrivileged();
        return ResponseEntity.ok(CommonResponse.success(ruleService.setActive(ruleId, request.getActive())));
    }

    @PostMapping("/reload")
    public ResponseEntity<CommonResponse<Integer>> reload(RequestPrincipal principal) {
        principal.requirePrivileged();
        int active = ruleService.reload();
        return ResponseEntity.ok(CommonResponse.success(active, "Rules reloaded"));
    }
}
