package com.taleforge.engine.lock;

import com.taleforge.core.exception.StateConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-writer discipline per campaign.
 *
 * Turn processing and rewind both hold the campaign's lock for their whole
 * duration. A zero wait timeout rejects a second submission immediately;
 * a positive one queues it for up to that long. A campaign's entry is
 * dropped when its lock is released and nobody is waiting for it.
 *
 * Usage:
 * <pre>
 * try (var lock = lockManager.acquire(campaignId)) {
 *     // mutate the campaign log
 * }
 * </pre>
 */
public class CampaignLockManager {

    private static final Logger log = LoggerFactory.getLogger(CampaignLockManager.class);

    private final Map<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration waitTimeout;

    public CampaignLockManager(Duration waitTimeout) {
        this.waitTimeout = waitTimeout != null ? waitTimeout : Duration.ZERO;
    }

    /**
     * Acquire the exclusive lock for a campaign.
     *
     * @throws StateConflictException if the lock is not obtained within the wait timeout
     */
    public CampaignLock acquire(UUID campaignId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(campaignId, id -> new ReentrantLock());
            boolean acquired;
            try {
                acquired = waitTimeout.isZero()
                    ? lock.tryLock()
                    : lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StateConflictException(campaignId, "interrupted while waiting for the campaign lock");
            }
            if (!acquired) {
                log.warn("Campaign {} is locked by another turn or rewind", campaignId);
                throw StateConflictException.lockHeld(campaignId);
            }
            if (locks.get(campaignId) == lock) {
                log.debug("Acquired lock for campaign {}", campaignId);
                return new CampaignLock(campaignId, lock, this);
            }
            // the entry was dropped as idle before this thread got it
            lock.unlock();
        }
    }

    public boolean isLocked(UUID campaignId) {
        ReentrantLock lock = locks.get(campaignId);
        return lock != null && lock.isLocked();
    }

    /**
     * Number of campaigns whose lock is currently held.
     */
    public int heldCount() {
        return (int) locks.values().stream().filter(ReentrantLock::isLocked).count();
    }

    /**
     * Number of campaigns with a lock entry. Entries are dropped once released
     * with no other thread waiting.
     */
    public int trackedCount() {
        return locks.size();
    }

    public Duration waitTimeout() {
        return waitTimeout;
    }

    /**
     * A held campaign lock, released on close by the thread that acquired it.
     */
    public static final class CampaignLock implements AutoCloseable {

        private final UUID campaignId;
        private final ReentrantLock lock;
        private final CampaignLockManager manager;

        private CampaignLock(UUID campaignId, ReentrantLock lock, CampaignLockManager manager) {
            this.campaignId = campaignId;
            this.lock = lock;
            this.manager = manager;
        }

        public UUID campaignId() {
            return campaignId;
        }

        @Override
        public void close() {
            lock.unlock();
            manager.locks.computeIfPresent(campaignId,
                (id, current) -> current == lock && !lock.isLocked() && !lock.hasQueuedThreads() ? null : current);
            log.debug("Released lock for campaign {}", campaignId);
        }
    }
}
