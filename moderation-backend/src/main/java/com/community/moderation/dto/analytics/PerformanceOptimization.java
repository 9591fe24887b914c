package com.community.moderation.dto.analytics;

import com.community.moderation.model.ImplementationCost;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class PerformanceOptimization {

    private String area;

    // 0 - 100
    private double currentEfficiency;

    // 可提升的百分点
    private double potentialImprovement;

    private ImplementationCost implementationCost;

    // 1 - 10，越大越优先
    private int priority;

    private String description;

    private List<String> steps = new ArrayList<>();
}
