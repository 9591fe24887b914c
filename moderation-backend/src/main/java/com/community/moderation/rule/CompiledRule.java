package com.community.moderation.rule;

import com.community.moderation.model.DecisionAction;
import com.community.moderation.model.Severity;

import java.util.List;

/**
 * 校验通过、可直接执行的规则
 */
final class CompiledRule {

    static final class Condition {
        final String signalPath;
        final ConditionOperator operator;
        final Object threshold;
        final double weight;

        Condition(String signalPath, ConditionOperator operator, Object threshold, double weight) {
            this.signalPath = signalPath;
            this.operator = operator;
            this.threshold = threshold;
            this.weight = weight;
        }
    }

    final String ruleId;
    final String name;
    final int priority;
    final double activationThreshold;
    final List<Condition> conditions;
    final DecisionAction decision;
    final Severity severityOverride;
    final String reason;
    final List<RuleActionType> sideEffects;

    CompiledRule(String ruleId, String name, int priority, double activationThreshold, List<Condition> conditions,
                 DecisionAction decision, Severity severityOverride, String reason, List<RuleActionType> sideEffects) {
        this.ruleId = ruleId;
        this.name = name;
        this.priority = priority;
        this.activationThreshold = activationThreshold;
        this.conditions = conditions;
        this.decision = decision;
        this.severityOverride = severityOverride;
        this.reason = reason;
        this.sideEffects = sideEffects;
    }

    /**
     * 加权匹配度 = Σ(weight_i × met_i) / Σ(weight_i)
     */
    double matchScore(SignalBundle bundle) {
        double totalWeight = 0.0;
        double matchedWeight = 0.0;
        for (Condition condition : conditions) {
            totalWeight += condition.weight;
            if (condition.operator.test(bundle.resolve(condition.signalPath), condition.threshold)) {
                matchedWeight += condition.weight;
            }
        }
        return totalWeight > 0 ? matchedWeight / totalWeight : 0.0;
    }

    RuleMatch toMatch(double matchScore) {
        return new RuleMatch(ruleId, name, matchScore, activationThreshold, decision, severityOverride, reason,
                sideEffects);
    }
}
