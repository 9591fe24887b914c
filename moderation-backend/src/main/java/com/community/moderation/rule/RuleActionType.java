package com.community.moderation.rule;

import com.community.moderation.model.DecisionAction;

/**
 * 规则动作类型。前四种决定最终审核动作，其余为附带的副作用。
 */
public enum RuleActionType {
    ALLOW("allow", DecisionAction.ALLOW),
    FLAG("flag", DecisionAction.FLAG),
    REVIEW("review", DecisionAction.REVIEW),
    BLOCK("block", DecisionAction.BLOCK),
    WARN("warn", null),
    NOTIFY("notify", null),
    ESCALATE("escalate", null);

    private final String code;
    private final DecisionAction decision;

    RuleActionType(String code, DecisionAction decision) {
        this.code = code;
        this.decision = decision;
    }

    public String getCode() {
        return code;
    }

    public DecisionAction getDecision() {
        return decision;
    }

    public boolean isDecision() {
        return decision != null;
    }

    public static RuleActionType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (RuleActionType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        return null;
    }
}
