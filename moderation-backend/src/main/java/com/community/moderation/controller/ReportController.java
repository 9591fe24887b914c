package com.community.moderation.controller;

import com.community.moderation.dto.CommonResponse;
import com.community.moderation.dto.ReportRequest;
import com.community.moderation.entity.ContentReport;
import com.community.moderation.model.ReportStatus;
import com.community.moderation.model.RequestPrincipal;
import com.community.moderation.service.ContentReportService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/moderation/reports")
public class ReportController {

    private final ContentReportService reportService;

    public ReportController(ContentReportService reportService) {
        this.reportService = reportService;
    }

    @PostMapping
    public ResponseEntity<CommonResponse<ContentReport>> createReport(RequestPrincipal principal,
                                                                      @Valid @RequestBody ReportRequest request) {
        ContentReport report = reportService.createReport(request, principal.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommonResponse.success(report, "Report submitted"));
    }

    /**
     * 普通用户返回自己的举报，审核员返回全部
     */
    @GetMapping
    public ResponseEntity<CommonResponse<List<ContentReport>>> listReports(RequestPrincipal principal,
                                                                           @RequestParam(required = false) String status,
                                                                           @RequestParam(required = false) Integer limit) {
        ReportStatus reportStatus = status == null ? null : ReportStatus.fromCode(status);
        return ResponseEntity.ok(CommonResponse.success(reportService.listReports(principal, reportStatus, limit)));
    }
}
