package com.itms.backend.support;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import com.itms.backend.modules.booking.application.ResourceLock;

/**
 * One {@link ReentrantLock} per resource id.
 */
public class InProcessResourceLock implements ResourceLock {

    private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public <T> T withLock(UUID resourceId, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(resourceId, key -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
