package tech.cids.platform.common;

import java.util.function.Supplier;

/**
 * Runs a block of repository writes as one transaction.
 *
 * <p>Callers that keep an in-memory view of persisted state (the permission registry) write
 * through this first and refresh their view only after it returns, so a rolled-back
 * transaction never leaves the view ahead of the store.
 */
public interface UnitOfWork {

    /**
     * Run {@code work} in a transaction, joining the caller's transaction if one is active.
     * Any runtime exception thrown by {@code work} rolls the transaction back and propagates.
     */
    <T> T inTransaction(Supplier<T> work);

    default void inTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }
}
