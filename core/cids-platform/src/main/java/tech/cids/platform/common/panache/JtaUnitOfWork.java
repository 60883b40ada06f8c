package tech.cids.platform.common.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.cids.platform.common.UnitOfWork;

import java.util.function.Supplier;

/**
 * {@link UnitOfWork} backed by the container-managed JTA transaction.
 */
@ApplicationScoped
public class JtaUnitOfWork implements UnitOfWork {

    @Override
    @Transactional
    public <T> T inTransaction(Supplier<T> work) {
        return work.get();
    }

    @Override
    @Transactional
    public void inTransaction(Runnable work) {
        work.run();
    }
}
