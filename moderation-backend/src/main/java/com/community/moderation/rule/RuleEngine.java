package com.community.moderation.rule;

import com.community.moderation.config.ModerationProperties;
import com.community.moderation.entity.ModerationRule;
import com.community.moderation.exception.ValidationException;
import com.community.moderation.model.DecisionAction;
import com.community.moderation.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 通用规则解释器。
 * 规则按 priority 降序、ruleId 升序排列；第一条命中的规则决定动作，其余命中规则只记录 id。
 * 规则集以不可变快照形式整体替换，加载时不阻塞正在进行的评估。
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    static final Comparator<CompiledRule> EVALUATION_ORDER = Comparator
            .comparingInt((CompiledRule rule) -> rule.priority).reversed()
            .thenComparing(rule -> rule.ruleId);

    private final ModerationProperties properties;

    private final AtomicReference<List<CompiledRule>> snapshot = new AtomicReference<>(Collections.emptyList());

    // 自上次刷新以来的命中次数
    private final Map<String, AtomicLong> triggerCounts = new ConcurrentHashMap<>();

    public RuleEngine(ModerationProperties properties) {
        this.properties = properties;
    }

    /**
     * 编译并替换当前规则集。停用的规则被忽略，格式错误的规则记录警告后跳过。
     *
     * @return 实际生效的规则数
     */
    public int load(List<ModerationRule> rules) {
        List<CompiledRule> compiled = new ArrayList<>();
        for (ModerationRule rule : rules) {
            if (!rule.isActive()) {
                continue;
            }
            CompiledRule result = compile(rule);
            if (result != null) {
                compiled.add(result);
            }
        }
        compiled.sort(EVALUATION_ORDER);
        snapshot.set(Collections.unmodifiableList(compiled));
        log.info("规则集已加载，共 {} 条生效规则。", compiled.size());
        return compiled.size();
    }

    public RuleEvaluation evaluate(SignalBundle bundle) {
        List<CompiledRule> rules = snapshot.get();
        List<String> triggered = new ArrayList<>();
        RuleMatch winner = null;

        for (CompiledRule rule : rules) {
            double score;
            try {
                score = rule.matchScore(bundle);
            } catch (RuntimeException e) {
                log.warn("规则 {} 评估失败，已跳过: {}", rule.ruleId, e.getMessage());
                continue;
            }
            if (score >= rule.activationThreshold) {
                triggered.add(rule.ruleId);
                triggerCounts.computeIfAbsent(rule.ruleId, id -> new AtomicLong()).incrementAndGet();
                if (winner == null) {
                    winner = rule.toMatch(score);
                }
            }
        }
        return new RuleEvaluation(winner, triggered);
    }

    /**
     * 取出并清零命中计数
     */
    public Map<String, Long> drainTriggerCounts() {
        Map<String, Long> drained = new LinkedHashMap<>();
        for (Map.Entry<String, AtomicLong> entry : triggerCounts.entrySet()) {
            long count = entry.getValue().getAndSet(0);
            if (count > 0) {
                drained.put(entry.getKey(), count);
            }
        }
        return drained;
    }

    public List<String> activeRuleIds() {
        List<String> ids = new ArrayList<>();
        for (CompiledRule rule : snapshot.get()) {
            ids.add(rule.ruleId);
        }
        return ids;
    }

    /**
     * 校验规则，返回错误描述；合法时返回 null
     */
    public String validate(ModerationRule rule) {
        try {
            toCompiled(rule);
            return null;
        } catch (IllegalArgumentException e) {
            return e.getMessage();
        }
    }

    private CompiledRule compile(ModerationRule rule) {
        try {
            return toCompiled(rule);
        } catch (IllegalArgumentException e) {
            log.warn("规则 {} 格式错误，已跳过: {}", rule.getRuleId(), e.getMessage());
            return null;
        }
    }

    private CompiledRule toCompiled(ModerationRule rule) {
        if (rule.getRuleId() == null || rule.getRuleId().isBlank()) {
            throw new IllegalArgumentException("rule id is required");
        }
        if (rule.getConditions() == null || rule.getConditions().isEmpty()) {
            throw new IllegalArgumentException("at least one condition is required");
        }

        // --- 1. 条件 ---
        List<CompiledRule.Condition> conditions = new ArrayList<>();
        for (RuleCondition condition : rule.getConditions()) {
            ConditionOperator operator = ConditionOperator.fromCode(condition.getOperator());
            if (operator == null) {
                throw new IllegalArgumentException("unknown condition operator '" + condition.getOperator() + "'");
            }
            if (condition.getSignalPath() == null || condition.getSignalPath().isBlank()) {
                throw new IllegalArgumentException("condition signalPath is required");
            }
            if (condition.getWeight() <= 0) {
                throw new IllegalArgumentException("condition weight must be positive");
            }
            conditions.add(new CompiledRule.Condition(condition.getSignalPath().trim(), operator,
                    condition.getThreshold(), condition.getWeight()));
        }

        // --- 2. 动作 ---
        DecisionAction decision = null;
        Severity severityOverride = null;
        String reason = null;
        List<RuleActionType> sideEffects = new ArrayList<>();
        for (RuleAction action : rule.getActions() == null ? Collections.<RuleAction>emptyList() : rule.getActions()) {
            RuleActionType type = RuleActionType.fromCode(action.getType());
            if (type == null) {
                throw new IllegalArgumentException("unknown action type '" + action.getType() + "'");
            }
            if (type.isDecision()) {
                if (decision == null) {
                    decision = type.getDecision();
                    severityOverride = parseSeverity(action.parameter("severity"));
                    reason = action.parameter("reason");
                }
            } else {
                sideEffects.add(type);
            }
        }
        if (decision == null) {
            throw new IllegalArgumentException("rule needs one of allow/flag/review/block actions");
        }

        double threshold = rule.getActivationThreshold() != null
                ? rule.getActivationThreshold()
                : properties.getRules().getDefaultActivationThreshold();
        return new CompiledRule(rule.getRuleId(), rule.getName(), rule.getPriority(), threshold, conditions,
                decision, severityOverride, reason != null ? reason : rule.getName(), sideEffects);
    }

    private Severity parseSeverity(String code) {
        if (code == null) {
            return null;
        }
        try {
            return Severity.fromCode(code);
        } catch (ValidationException e) {
            throw new IllegalArgumentException("unknown severity '" + code + "'");
        }
    }
}
