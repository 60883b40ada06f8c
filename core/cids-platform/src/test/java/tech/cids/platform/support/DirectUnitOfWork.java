package tech.cids.platform.support;

import tech.cids.platform.common.UnitOfWork;

import java.util.function.Supplier;

/**
 * Runs work inline and counts transactions, for tests without a database.
 */
public class DirectUnitOfWork implements UnitOfWork {

    private int transactions;

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        transactions++;
        return work.get();
    }

    public int transactions() {
        return transactions;
    }
}
