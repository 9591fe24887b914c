package com.community.moderation.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 调用方角色，由请求头 X-User-Role 提供
 */
public enum UserRole {
    USER("user"),
    MODERATOR("moderator"),
    ADMIN("admin");

    private final String code;

    UserRole(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isPrivileged() {
        return this == MODERATOR || this == ADMIN;
    }

    public static UserRole fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (UserRole role : values()) {
            if (role.code.equalsIgnoreCase(code.trim())) {
                return role;
            }
        }
        return null;
    }
}
