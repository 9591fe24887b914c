package com.community.moderation.service;

import com.community.moderation.dto.RuleRequest;
import com.community.moderation.entity.ModerationRule;
import com.community.moderation.model.SeverityRating;

import java.util.List;
import java.util.Optional;

/**
 * 规则的增删改与运行时重载，修改后立即生效，无需重启
 */
public interface RuleService {

    List<ModerationRule> listRules();

    ModerationRule getRule(String ruleId);

    ModerationRule createRule(RuleRequest request);

    ModerationRule updateRule(String ruleId, RuleRequest request);

    ModerationRule setActive(String ruleId, boolean active);

    /**
     * 从存储重新加载规则集到规则引擎
     *
     * @return 生效规则数
     */
    int reload();

    /**
     * 表中无规则时导入种子规则
     *
     * @return 导入数量
     */
    int seedIfEmpty();

    /**
     * 按社区反馈方向调整一步激活阈值，结果限制在 [min, max]。
     * too_strict 提高阈值，too_lenient 降低阈值。
     *
     * @return 调整后的阈值；规则不存在或已到边界时为空
     */
    Optional<Double> adjustThreshold(String ruleId, SeverityRating direction);
}
