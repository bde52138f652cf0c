package com.taleforge.engine.lock;

import com.taleforge.core.exception.StateConflictException;
import com.taleforge.engine.lock.CampaignLockManager.CampaignLock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CampaignLockManagerTest {

    private final UUID campaignId = UUID.randomUUID();

    @Test
    void secondWriterIsRejectedWithoutTimeout() throws Exception {
        CampaignLockManager locks = new CampaignLockManager(Duration.ZERO);
        ExecutorService other = Executors.newSingleThreadExecutor();
        try (CampaignLock held = locks.acquire(campaignId)) {
            assertTrue(locks.isLocked(campaignId));

            Future<?> attempt = other.submit(() -> locks.acquire(campaignId));

            ExecutionAssertions.assertCause(StateConflictException.class, attempt);
        } finally {
            other.shutdownNow();
        }
        assertFalse(locks.isLocked(campaignId));
    }

    @Test
    void waiterGetsTheLockOnceReleased() throws Exception {
        CampaignLockManager locks = new CampaignLockManager(Duration.ofSeconds(5));
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> holder = pool.submit(() -> {
                try (CampaignLock lock = locks.acquire(campaignId)) {
                    holding.countDown();
                    release.await(5, TimeUnit.SECONDS);
                }
                return null;
            });
            assertTrue(holding.await(5, TimeUnit.SECONDS));

            Future<Boolean> waiter = pool.submit(() -> {
                try (CampaignLock lock = locks.acquire(campaignId)) {
                    return true;
                }
            });
            release.countDown();

            assertTrue(waiter.get(5, TimeUnit.SECONDS));
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void waitTimesOut() throws Exception {
        CampaignLockManager locks = new CampaignLockManager(Duration.ofMillis(50));
        ExecutorService other = Executors.newSingleThreadExecutor();
        try (CampaignLock held = locks.acquire(campaignId)) {
            Future<?> attempt = other.submit(() -> locks.acquire(campaignId));

            ExecutionAssertions.assertCause(StateConflictException.class, attempt);
        } finally {
            other.shutdownNow();
        }
    }

    @Test
    void campaignsDoNotBlockEachOther() {
        CampaignLockManager locks = new CampaignLockManager(Duration.ZERO);
        UUID other = UUID.randomUUID();

        try (CampaignLock first = locks.acquire(campaignId);
             CampaignLock second = locks.acquire(other)) {
            assertEquals(2, locks.heldCount());
        }
        assertEquals(0, locks.heldCount());
    }

    @Test
    void releasedCampaignsAreForgotten() {
        CampaignLockManager locks = new CampaignLockManager(Duration.ZERO);

        for (int i = 0; i < 100; i++) {
            try (CampaignLock lock = locks.acquire(UUID.randomUUID())) {
                assertEquals(1, locks.trackedCount());
            }
        }

        assertEquals(0, locks.trackedCount());
    }

    @Test
    void reentrantHoldKeepsTheEntryUntilOutermostRelease() {
        CampaignLockManager locks = new CampaignLockManager(Duration.ZERO);

        try (CampaignLock outer = locks.acquire(campaignId)) {
            try (CampaignLock inner = locks.acquire(campaignId)) {
                assertEquals(1, locks.trackedCount());
            }
            assertTrue(locks.isLocked(campaignId));
            assertEquals(1, locks.trackedCount());
        }

        assertFalse(locks.isLocked(campaignId));
        assertEquals(0, locks.trackedCount());
    }

    @Test
    void contendedCampaignNeverHasTwoHolders() throws Exception {
        CampaignLockManager locks = new CampaignLockManager(Duration.ofSeconds(10));
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> workers = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                workers.add(pool.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        try (CampaignLock lock = locks.acquire(campaignId)) {
                            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                            inside.decrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> worker : workers) {
                worker.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, maxInside.get());
        assertEquals(0, locks.trackedCount());
    }

    @Test
    void nullTimeoutMeansNoWait() {
        assertEquals(Duration.ZERO, new CampaignLockManager(null).waitTimeout());
    }
}
