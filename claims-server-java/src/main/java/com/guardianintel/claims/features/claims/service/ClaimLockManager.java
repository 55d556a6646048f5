package com.guardianintel.claims.features.claims.service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.guardianintel.claims.exception.ConcurrencyConflictException;

import lombok.extern.slf4j.Slf4j;

/**
 * One {@link ReentrantLock} per claim id, created on first use and dropped when
 * the last holder or waiter leaves. Different claims never share a lock.
 * <pre>
 * try (ClaimLockManager.Handle ignored = lockManager.acquire(claimId)) {
 *     // load, mutate, save
 * }
 * </pre>
 */
@Component
@Slf4j
public class ClaimLockManager {

    private final ConcurrentHashMap<Long, LockEntry> locks = new ConcurrentHashMap<>();
    private final Duration waitTimeout;

    public ClaimLockManager(@Value("${claims.lock.wait-timeout:5s}") Duration waitTimeout) {
        this.waitTimeout = waitTimeout;
    }

    /**
     * @throws ConcurrencyConflictException if the lock is not obtained within the wait timeout
     *                                      or the thread is interrupted while waiting
     */
    public Handle acquire(Long claimId) {
        LockEntry entry = locks.compute(claimId, (id, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.users++;
            return e;
        });

        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release(claimId, entry);
            throw new ConcurrencyConflictException(claimId, "interrupted while waiting for the claim lock", e);
        }

        if (!acquired) {
            release(claimId, entry);
            log.warn("Claim {} is busy; gave up after {}ms", claimId, waitTimeout.toMillis());
            throw new ConcurrencyConflictException(claimId, "another operation is in progress on this claim");
        }
        return new Handle(claimId, entry);
    }

    /** Number of claim ids with a live lock entry. */
    int activeLocks() {
        return locks.size();
    }

    private void release(Long claimId, LockEntry entry) {
        locks.computeIfPresent(claimId, (id, current) -> {
            if (current != entry) {
                return current;
            }
            current.users--;
            return current.users == 0 ? null : current;
        });
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        // Guarded by the map's compute for this key
        private int users;
    }

    public final class Handle implements AutoCloseable {
        private final Long claimId;
        private final LockEntry entry;
        private boolean closed;

        private Handle(Long claimId, LockEntry entry) {
            this.claimId = claimId;
            this.entry = entry;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            entry.lock.unlock();
            release(claimId, entry);
        }
    }
}
