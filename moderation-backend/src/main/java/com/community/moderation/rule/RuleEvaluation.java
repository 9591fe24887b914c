package com.community.moderation.rule;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 一次规则评估的结果。winner 为空表示没有规则命中，应回落到默认阈值策略。
 */
@Data
@AllArgsConstructor
public class RuleEvaluation {

    private RuleMatch winner;

    // 所有命中的规则，按评估顺序
    private List<String> triggeredRuleIds;

    public boolean hasWinner() {
        return winner != null;
    }
}
