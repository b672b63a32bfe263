package com.github.salilvnair.convflow.engine.stack;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes read-modify-write cycles on one session's stack. Different
 * sessions never share a lock. A lock is dropped as soon as no thread holds
 * or waits for it, so the registry only ever holds sessions in use.
 */
@Slf4j
@Component
public class SessionLockRegistry {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String sessionId, Supplier<T> action) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(sessionId, ignored -> new ReentrantLock());
            lock.lock();
            if (locks.get(sessionId) != lock) {
                // dropped between lookup and acquisition
                lock.unlock();
                continue;
            }
            try {
                return action.get();
            } finally {
                lock.unlock();
                locks.computeIfPresent(sessionId, (id, current) -> isIdle(current, lock) ? null : current);
            }
        }
    }

    private static boolean isIdle(ReentrantLock current, ReentrantLock released) {
        return current == released && !current.isLocked() && !current.hasQueuedThreads();
    }

    public int size() {
        return locks.size();
    }

    @PreDestroy
    void clear() {
        log.debug("Releasing {} session locks", locks.size());
        locks.clear();
    }
}
