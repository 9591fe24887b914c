package com.community.moderation.entity;

import com.community.moderation.rule.RuleAction;
import com.community.moderation.rule.RuleCondition;
import com.community.moderation.util.RuleActionsConverter;
import com.community.moderation.util.RuleConditionsConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * ModerationRule Entity: 声明式审核规则。条件与动作以 JSON 存储，由 RuleEngine 统一解释执行。
 */
@Entity
@Data
@Table(name = "moderationrule")
public class ModerationRule implements Serializable {

    @Id
    @Column(name = "rule_id", length = 64)
    private String ruleId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    // 数值越大越先评估
    @Column(name = "priority", nullable = false)
    private int priority;

    @Convert(converter = RuleConditionsConverter.class)
    @Column(name = "conditions", columnDefinition = "TEXT")
    private List<RuleCondition> conditions = new ArrayList<>();

    @Convert(converter = RuleActionsConverter.class)
    @Column(name = "actions", columnDefinition = "TEXT")
    private List<RuleAction> actions = new ArrayList<>();

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    // 加权匹配度达到该值时规则命中；为空时使用全局默认值
    @Column(name = "activation_threshold")
    private Double activationThreshold;

    @Column(name = "times_triggered", nullable = false)
    private long timesTriggered;

    @Column(name = "last_triggered_at")
    private LocalDateTime lastTriggeredAt;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
