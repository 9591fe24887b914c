package com.community.moderation.rule;

import com.community.moderation.model.DecisionAction;
import com.community.moderation.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 胜出规则及其要执行的动作
 */
@Data
@AllArgsConstructor
public class RuleMatch {

    private String ruleId;

    private String ruleName;

    private double matchScore;

    private double activationThreshold;

    private DecisionAction decision;

    // 规则参数指定的严重程度，为空时按分数推导
    private Severity severityOverride;

    private String reason;

    private List<RuleActionType> sideEffects;
}
