package com.community.moderation.model;

import com.community.moderation.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 审核员对队列项的处理动作。approve 以外的动作都会让队列项进入 rejected。
 */
public enum ResolutionAction {
    APPROVE("approve"),
    REJECT("reject"),
    EDIT("edit"),
    WARN("warn"),
    BAN("ban");

    private final String code;

    ResolutionAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public QueueStatus resultingStatus() {
        return this == APPROVE ? QueueStatus.APPROVED : QueueStatus.REJECTED;
    }

    @JsonCreator
    public static ResolutionAction fromCode(String code) {
        for (ResolutionAction action : values()) {
            if (action.code.equalsIgnoreCase(code)) {
                return action;
            }
        }
        throw new ValidationException("Invalid action. Must be one of: approve, reject, edit, warn, ban");
    }
}
