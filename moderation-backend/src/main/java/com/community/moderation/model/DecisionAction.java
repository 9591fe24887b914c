package com.community.moderation.model;

import com.community.moderation.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 自动审核的最终动作
 */
public enum DecisionAction {
    ALLOW("allow"),
    FLAG("flag"),
    REVIEW("review"),
    BLOCK("block");

    private final String code;

    DecisionAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static DecisionAction fromCode(String code) {
        for (DecisionAction action : values()) {
            if (action.code.equalsIgnoreCase(code)) {
                return action;
            }
        }
        throw new ValidationException("Invalid decision action: " + code);
    }
}
