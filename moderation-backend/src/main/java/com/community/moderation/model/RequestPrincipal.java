package com.community.moderation.model;

import com.community.moderation.exception.ForbiddenException;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 已认证的调用方
 */
@Data
@AllArgsConstructor
public class RequestPrincipal {

    private String userId;

    private UserRole role;

    public boolean isPrivileged() {
        return role != null && role.isPrivileged();
    }

    public void requirePrivileged() {
        if (!isPrivileged()) {
            throw new ForbiddenException("Moderator or admin role required");
        }
    }
}
