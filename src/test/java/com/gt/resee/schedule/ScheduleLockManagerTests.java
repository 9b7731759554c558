package com.gt.resee.schedule;

import com.gt.resee.exception.LockConflictException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.PessimisticLockingFailureException;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ScheduleLockManagerTests {

    private static final String TEST_LEARNER_ID = "learner-1";

    private ScheduleLockManager scheduleLockManager;
    private ExecutorService executorService;

    @BeforeEach
    public void setup() {
        scheduleLockManager = new ScheduleLockManager(3, 50, 5);
        executorService = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    public void teardown() {
        executorService.shutdownNow();
    }

    @Test
    public void testWithPairLock() {
        assertEquals("done", scheduleLockManager.withPairLock(TEST_LEARNER_ID, "content-1", () -> "done"));
        assertEquals(0, scheduleLockManager.heldKeyCount());
    }

    @Test
    public void testWithPairLock_Reentrant() {
        String result = scheduleLockManager.withPairLock(TEST_LEARNER_ID, "content-1",
                () -> scheduleLockManager.withPairLock(TEST_LEARNER_ID, "content-1", () -> "nested"));

        assertEquals("nested", result);
        assertEquals(0, scheduleLockManager.heldKeyCount());
    }

    @Test
    public void testWithPairLock_ConflictAfterRetries() throws Exception {
        CountDownLatch lockHeld = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger attempts = new AtomicInteger();

        Future<?> holder = executorService.submit(() -> scheduleLockManager.withPairLock(TEST_LEARNER_ID, "content-1", () -> {
            lockHeld.countDown();
            await(release);
            return null;
        }));

        assertTrue(lockHeld.await(5, TimeUnit.SECONDS));
        assertThrows(LockConflictException.class, () -> scheduleLockManager.withPairLock(TEST_LEARNER_ID, "content-1", () -> {
            attempts.incrementAndGet();
            return null;
        }));
        assertEquals(0, attempts.get());

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        assertEquals(0, scheduleLockManager.heldKeyCount());
    }

    @Test
    public void testWithPairLock_DifferentContentRunsInParallel() throws Exception {
        CountDownLatch lockHeld = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> holder = executorService.submit(() -> scheduleLockManager.withPairLock(TEST_LEARNER_ID, "content-1", () -> {
            lockHeld.countDown();
            await(release);
            return null;
        }));

        assertTrue(lockHeld.await(5, TimeUnit.SECONDS));
        assertEquals("other", scheduleLockManager.withPairLock(TEST_LEARNER_ID, "content-2", () -> "other"));
        assertEquals("other learner", scheduleLockManager.withPairLock("learner-2", "content-1", () -> "other learner"));

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
    }

    @Test
    public void testWithPairLock_IdsContainingSeparatorsDoNotShareLock() throws Exception {
        CountDownLatch lockHeld = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> holder = executorService.submit(() -> scheduleLockManager.withPairLock("a/b", "c", () -> {
            lockHeld.countDown();
            await(release);
            return null;
        }));

        assertTrue(lockHeld.await(5, TimeUnit.SECONDS));
        assertEquals("independent", scheduleLockManager.withPairLock("a", "b/c", () -> "independent"));

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        assertEquals(0, scheduleLockManager.heldKeyCount());
    }

    @Test
    public void testWithPairLock_RetriesRowLockFailure() {
        AtomicInteger attempts = new AtomicInteger();

        String result = scheduleLockManager.withPairLock(TEST_LEARNER_ID, "content-1", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new PessimisticLockingFailureException("row locked");
            }
            return "locked on third attempt";
        });

        assertEquals("locked on third attempt", result);
        assertEquals(3, attempts.get());
    }

    @Test
    public void testWithPairLock_RowLockFailureExhausted() {
        AtomicInteger attempts = new AtomicInteger();

        LockConflictException ex = assertThrows(LockConflictException.class, () -> scheduleLockManager.withPairLock(TEST_LEARNER_ID, "content-1", () -> {
            attempts.incrementAndGet();
            throw new PessimisticLockingFailureException("row locked");
        }));

        assertEquals(3, attempts.get());
        assertInstanceOf(PessimisticLockingFailureException.class, ex.getCause());
        assertEquals(0, scheduleLockManager.heldKeyCount());
    }

    @Test
    public void testWithPairLock_OtherFailuresAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> scheduleLockManager.withPairLock(TEST_LEARNER_ID, "content-1", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("boom");
        }));

        assertEquals(1, attempts.get());
        assertEquals(0, scheduleLockManager.heldKeyCount());
    }

    @Test
    public void testWithLearnerLock_ExcludesPairLocks() throws Exception {
        CountDownLatch lockHeld = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> holder = executorService.submit(() -> scheduleLockManager.withLearnerLock(TEST_LEARNER_ID, () -> {
            lockHeld.countDown();
            await(release);
            return null;
        }));

        assertTrue(lockHeld.await(5, TimeUnit.SECONDS));
        assertThrows(LockConflictException.class, () -> scheduleLockManager.withPairLock(TEST_LEARNER_ID, "content-1", () -> null));
        assertEquals("other learner", scheduleLockManager.withPairLock("learner-2", "content-1", () -> "other learner"));

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        assertEquals(0, scheduleLockManager.heldKeyCount());
    }

    @Test
    public void testWithLearnerLock_WaitsForPairLock() throws Exception {
        CountDownLatch lockHeld = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean pairFinished = new AtomicBoolean();

        Future<?> holder = executorService.submit(() -> scheduleLockManager.withPairLock(TEST_LEARNER_ID, "content-1", () -> {
            lockHeld.countDown();
            await(release);
            pairFinished.set(true);
            return null;
        }));
        assertTrue(lockHeld.await(5, TimeUnit.SECONDS));

        Future<Boolean> batch = executorService.submit(() -> scheduleLockManager.withLearnerLock(TEST_LEARNER_ID, pairFinished::get));
        Thread.sleep(100);
        assertFalse(batch.isDone());

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        assertTrue(batch.get(5, TimeUnit.SECONDS));
        assertEquals(0, scheduleLockManager.heldKeyCount());
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
