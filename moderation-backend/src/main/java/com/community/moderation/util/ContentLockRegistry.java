package com.community.moderation.util;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 按 contentId 串行化队列写操作的分段锁。不同 contentId 大概率落在不同分段上，互不阻塞。
 */
@Component
public class ContentLockRegistry {

    private static final int STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public ContentLockRegistry() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String contentId, Supplier<T> action) {
        ReentrantLock lock = lockFor(contentId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String contentId) {
        int hash = contentId == null ? 0 : contentId.hashCode();
        return locks[Math.floorMod(hash, STRIPES)];
    }
}
