package tech.cids.platform.lock;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Abstraction for named critical sections.
 *
 * <p>The permission registry takes one lock per application ID so that catalog
 * replacement and role writes for the same application never interleave, while
 * different applications proceed in parallel.
 */
public interface DistributedLock {

    /**
     * Try to acquire a lock with the given name.
     *
     * @param lockName Unique name for the lock
     * @param timeout Maximum time to wait for the lock
     * @return A lock handle if acquired, empty if the timeout elapsed
     */
    Optional<LockHandle> tryAcquire(String lockName, Duration timeout);

    /**
     * Execute a task while holding a lock.
     *
     * @return The task result if the lock was acquired, empty otherwise
     */
    default <T> Optional<T> withLock(String lockName, Duration timeout, Supplier<T> task) {
        return tryAcquire(lockName, timeout).map(handle -> {
            try {
                return task.get();
            } finally {
                handle.release();
            }
        });
    }

    /**
     * Execute a task while holding a lock (void version).
     *
     * @return true if the lock was acquired and the task executed, false otherwise
     */
    default boolean withLock(String lockName, Duration timeout, Runnable task) {
        return withLock(lockName, timeout, () -> {
            task.run();
            return true;
        }).orElse(false);
    }

    /**
     * Handle to a held lock that can be released.
     */
    interface LockHandle extends AutoCloseable {
        void release();

        @Override
        default void close() {
            release();
        }
    }
}
