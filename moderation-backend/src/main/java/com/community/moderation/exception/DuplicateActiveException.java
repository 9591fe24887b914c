package com.community.moderation.exception;

import org.springframework.http.HttpStatus;

/**
 * 同一 contentId 已存在未终结的队列项
 */
public class DuplicateActiveException extends ConflictException {

    private final Long existingItemId;

    public DuplicateActiveException(String contentId, Long existingItemId) {
        super(HttpStatus.CONFLICT, "DUPLICATE_ACTIVE",
                "Content " + contentId + " already has an active queue item: " + existingItemId);
        this.existingItemId = existingItemId;
    }

    public Long getExistingItemId() {
        return existingItemId;
    }
}
