package com.community.moderation.dto.analytics;

import com.community.moderation.model.AlertType;
import com.community.moderation.model.Severity;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
public class PredictiveAlert {

    private String id;

    private AlertType type;

    private Severity severity;

    private String metric;

    private String prediction;

    private double probability;

    private String timeframe;

    private String impact;

    private List<String> recommendedActions = new ArrayList<>();

    private LocalDateTime createdAt;
}
