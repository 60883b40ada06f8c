package tech.cids.platform.lock;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process lock keyed by name, one {@link ReentrantLock} per key.
 *
 * <p>Reentrant so a registry operation holding an application's lock can call
 * another operation that takes the same lock on the same thread.
 *
 * <p>A key's entry is dropped when its last holder releases it and nobody is waiting, so
 * the map only holds keys in use. A thread that wins a lock which was dropped meanwhile
 * releases it and tries again on the current entry.
 */
@ApplicationScoped
public class KeyedReentrantLock implements DistributedLock {

    private static final Logger LOG = Logger.getLogger(KeyedReentrantLock.class);

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public Optional<LockHandle> tryAcquire(String lockName, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(lockName, name -> new ReentrantLock());
            try {
                if (!lock.tryLock(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                    LOG.debugf("Failed to acquire lock within timeout: %s", lockName);
                    return Optional.empty();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
            if (locks.get(lockName) == lock) {
                LOG.debugf("Acquired lock: %s (hold count %d)", lockName, lock.getHoldCount());
                return Optional.of(new ReentrantLockHandle(lockName, lock));
            }
            // entry was dropped between lookup and acquisition
            lock.unlock();
        }
    }

    /**
     * Whether any thread currently holds the named lock.
     */
    public boolean isLocked(String lockName) {
        ReentrantLock lock = locks.get(lockName);
        return lock != null && lock.isLocked();
    }

    int trackedKeys() {
        return locks.size();
    }

    private void evictIfIdle(String lockName, ReentrantLock lock) {
        locks.computeIfPresent(lockName, (name, current) ->
            current == lock && !current.isLocked() && !current.hasQueuedThreads() ? null : current);
    }

    private final class ReentrantLockHandle implements LockHandle {
        private final String lockName;
        private final ReentrantLock lock;
        private final AtomicBoolean released = new AtomicBoolean(false);

        ReentrantLockHandle(String lockName, ReentrantLock lock) {
            this.lockName = lockName;
            this.lock = lock;
        }

        @Override
        public void release() {
            if (released.compareAndSet(false, true)) {
                lock.unlock();
                evictIfIdle(lockName, lock);
                LOG.debugf("Released lock: %s", lockName);
            }
        }
    }
}
