package com.community.moderation.rule;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 规则条件：对 signalPath 取值，用 operator 与 threshold 比较，命中时贡献 weight
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RuleCondition {

    // 例如 signals.spam, reputation.tier, flags.professional_context
    private String signalPath;

    // 见 ConditionOperator 的编码
    private String operator;

    // 数值、字符串、布尔或列表
    private Object threshold;

    private double weight = 1.0;
}
