package com.gt.resee.schedule;

import com.gt.resee.exception.LockConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Serializes schedule mutations inside this process.
 * <p>
 * Pair operations ({@link #withPairLock}) hold the learner's read lock plus an exclusive lock on the
 * (learner, content) pair, so different pairs run in parallel. Learner batches ({@link #withLearnerLock}) hold the
 * learner's write lock and so exclude every pair operation of that learner. Lock entries are reference counted and
 * dropped once no thread holds or waits on them.
 * <p>
 * Pair operations retry a bounded number of times with linear backoff when a lock is not acquired in time or the
 * database reports a row lock failure, then give up with {@link LockConflictException}.
 */
@Component
public class ScheduleLockManager {

    private static final Logger log = LoggerFactory.getLogger(ScheduleLockManager.class);

    private final ConcurrentMap<String, KeyLock> learnerLocks = new ConcurrentHashMap<>();
    private final ConcurrentMap<PairKey, KeyLock> pairLocks = new ConcurrentHashMap<>();

    private final int maxAttempts;
    private final long lockWaitMs;
    private final long backoffMs;

    @Autowired
    public ScheduleLockManager(@Value("${resee.schedule.lock.maxAttempts:3}") int maxAttempts,
                               @Value("${resee.schedule.lock.waitMs:200}") long lockWaitMs,
                               @Value("${resee.schedule.lock.backoffMs:50}") long backoffMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.lockWaitMs = lockWaitMs;
        this.backoffMs = backoffMs;
    }

    public <T> T withPairLock(String learnerId, String contentId, Supplier<T> action) {
        PairKey pairKey = new PairKey(learnerId, contentId);

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            KeyLock learnerLock = acquireEntry(learnerLocks, learnerId);
            KeyLock pairLock = acquireEntry(pairLocks, pairKey);
            Lock learnerReadLock = learnerLock.lock.readLock();
            Lock pairWriteLock = pairLock.lock.writeLock();
            boolean learnerLocked = false;
            boolean pairLocked = false;

            try {
                learnerLocked = tryLock(learnerReadLock);
                pairLocked = learnerLocked && tryLock(pairWriteLock);

                if (pairLocked) {
                    return action.get();
                }

                log.warn("Lock busy for {} on attempt {} of {}", pairKey, attempt, maxAttempts);
            } catch (PessimisticLockingFailureException ex) {
                log.warn("Row lock failure for {} on attempt {} of {}", pairKey, attempt, maxAttempts, ex);
                if (attempt == maxAttempts) {
                    throw new LockConflictException("Could not lock schedule " + pairKey + " after " + maxAttempts + " attempts", ex);
                }
            } finally {
                if (pairLocked) {
                    pairWriteLock.unlock();
                }
                if (learnerLocked) {
                    learnerReadLock.unlock();
                }
                releaseEntry(pairLocks, pairKey);
                releaseEntry(learnerLocks, learnerId);
            }

            if (attempt < maxAttempts) {
                sleepBackoff(attempt);
            }
        }

        String errMsg = "Could not lock schedule " + pairKey + " after " + maxAttempts + " attempts";
        log.error(errMsg);
        throw new LockConflictException(errMsg);
    }

    // Waits as long as it takes; learner batches run off the request path and must not fail on contention
    public <T> T withLearnerLock(String learnerId, Supplier<T> action) {
        KeyLock learnerLock = acquireEntry(learnerLocks, learnerId);
        Lock learnerWriteLock = learnerLock.lock.writeLock();

        learnerWriteLock.lock();
        try {
            return action.get();
        } finally {
            learnerWriteLock.unlock();
            releaseEntry(learnerLocks, learnerId);
        }
    }

    int heldKeyCount() {
        return learnerLocks.size() + pairLocks.size();
    }

    private boolean tryLock(Lock lock) {
        try {
            return lock.tryLock(lockWaitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LockConflictException("Interrupted while waiting for schedule lock", ex);
        }
    }

    private void sleepBackoff(int attempt) {
        try {
            Thread.sleep(backoffMs * attempt);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LockConflictException("Interrupted while backing off for schedule lock", ex);
        }
    }

    private static <K> KeyLock acquireEntry(ConcurrentMap<K, KeyLock> locks, K key) {
        return locks.compute(key, (k, existing) -> {
            KeyLock keyLock = existing == null ? new KeyLock() : existing;
            keyLock.users++;
            return keyLock;
        });
    }

    private static <K> void releaseEntry(ConcurrentMap<K, KeyLock> locks, K key) {
        locks.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
    }

    private record PairKey(String learnerId, String contentId) {
        @Override
        public String toString() {
            return "learner " + learnerId + " content " + contentId;
        }
    }

    // users is only read and written inside ConcurrentHashMap.compute for its key
    private static final class KeyLock {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private int users;
    }
}
