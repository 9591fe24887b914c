package com.community.moderation.rule;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 规则命中后的动作。parameters 支持 severity（覆盖推导的严重程度）和 reason（入队原因）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RuleAction {

    private String type;

    private Map<String, String> parameters = new LinkedHashMap<>();

    public RuleAction(String type) {
        this.type = type;
    }

    public String parameter(String name) {
        return parameters == null ? null : parameters.get(name);
    }
}
