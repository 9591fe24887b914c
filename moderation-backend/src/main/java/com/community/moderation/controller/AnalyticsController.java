package com.community.moderation.controller;

import com.community.moderation.dto.CommonResponse;
import com.community.moderation.dto.analytics.Timeframe;
import com.community.moderation.exception.ValidationException;
import com.community.moderation.model.RequestPrincipal;
import com.community.moderation.service.ModerationAnalyticsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/moderation/analytics")
public class AnalyticsController {

    private final ModerationAnalyticsService analyticsService;

    public AnalyticsController(ModerationAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    /**
     * action: overview | trends | patterns | optimizations | alerts | real_time | export | comprehensive
     */
    @GetMapping
    public ResponseEntity<CommonResponse<Object>> getAnalytics(RequestPrincipal principal,
                                                               @RequestParam(required = false, defaultValue = "overview") String action,
                                                               @RequestParam(required = false) String period,
                                                               @RequestParam(required = false) String startDate,
                                                               @RequestParam(required = false) String endDate,
                                                               @RequestParam(required = false, defaultValue = "json") String format) {
        principal.requirePrivileged();

        if ("real_time".equals(action)) {
            return ResponseEntity.ok(CommonResponse.success(analyticsService.realTime()));
        }

        Timeframe timeframe = analyticsService.resolveTimeframe(period, startDate, endDate);
        Object data;
        switch (action) {
            case "overview":
                data = analyticsService.overview(timeframe);
                break;
            case "trends":
                data = analyticsService.trends(timeframe);
                break;
            case "patterns":
                data = analyticsService.patterns(timeframe);
                break;
            case "optimizations":
                data = analyticsService.optimizations(timeframe);
                break;
            case "alerts":
                data = analyticsService.alerts(timeframe);
                break;
            case "export":
                data = analyticsService.export(timeframe, format);
                break;
            case "comprehensive":
                data = analyticsService.generateReport(timeframe);
                break;
            default:
                throw new ValidationException("Invalid action: " + action);
        }
        return ResponseEntity.ok(CommonResponse.success(data));
    }
}
