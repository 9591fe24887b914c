package com.community.moderation.dto.analytics;

import com.community.moderation.model.RiskLevel;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class UserBehaviorPattern {

    private String pattern;

    private int userCount;

    private RiskLevel riskLevel;

    private String description;

    private List<String> indicators = new ArrayList<>();

    private List<String> suggestedActions = new ArrayList<>();
}
