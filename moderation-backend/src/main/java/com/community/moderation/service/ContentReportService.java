package com.community.moderation.service;

import com.community.moderation.dto.ReportRequest;
import com.community.moderation.entity.ContentReport;
import com.community.moderation.model.ReportStatus;
import com.community.moderation.model.RequestPrincipal;

import java.util.List;

public interface ContentReportService {

    /**
     * 创建举报并关联（或新建）该内容的活动队列项。
     * 同一举报人对同一内容已有未处理举报时拒绝。
     */
    ContentReport createReport(ReportRequest request, String reporterId);

    /**
     * 普通用户只能看到自己的举报，审核员可看到全部
     */
    List<ContentReport> listReports(RequestPrincipal principal, ReportStatus status, Integer limit);
}
