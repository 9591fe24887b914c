package com.community.moderation.dto.analytics;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsPatterns {

    private List<ContentInsight> contentInsights;

    private List<UserBehaviorPattern> userPatterns;
}
