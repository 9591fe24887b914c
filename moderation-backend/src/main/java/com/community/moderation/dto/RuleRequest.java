package com.community.moderation.dto;

import com.community.moderation.rule.RuleAction;
import com.community.moderation.rule.RuleCondition;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 新建/更新规则的请求体，也是种子规则文件的条目格式
 */
@Data
public class RuleRequest {

    @Size(max = 64)
    private String ruleId;

    @NotBlank(message = "Rule name is required")
    @Size(max = 100)
    private String name;

    @Size(max = 500)
    private String description;

    private int priority;

    @NotEmpty(message = "At least one condition is required")
    private List<RuleCondition> conditions = new ArrayList<>();

    @NotEmpty(message = "At least one action is required")
    private List<RuleAction> actions = new ArrayList<>();

    private Boolean active;

    private Double activationThreshold;
}
