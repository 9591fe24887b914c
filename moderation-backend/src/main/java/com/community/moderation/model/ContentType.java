package com.community.moderation.model;

import com.community.moderation.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 可被审核的内容类型
 */
public enum ContentType {
    QUESTION("question"),
    ANSWER("answer"),
    FORUM_POST("forum_post"),
    FORUM_REPLY("forum_reply"),
    STORY("story"),
    COMMENT("comment");

    private final String code;

    ContentType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ContentType fromCode(String code) {
        for (ContentType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new ValidationException("Invalid content type: " + code);
    }
}
