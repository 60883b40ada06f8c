package tech.cids.platform.lock;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class KeyedReentrantLockTest {

    private final KeyedReentrantLock lock = new KeyedReentrantLock();

    @Test
    void tryAcquire_shouldBeReentrantOnTheSameThread() {
        Optional<DistributedLock.LockHandle> outer = lock.tryAcquire("app:hr", Duration.ofMillis(100));
        Optional<DistributedLock.LockHandle> inner = lock.tryAcquire("app:hr", Duration.ofMillis(100));

        assertThat(outer).isPresent();
        assertThat(inner).isPresent();
        inner.get().release();
        assertThat(lock.isLocked("app:hr")).isTrue();
        outer.get().release();
        assertThat(lock.isLocked("app:hr")).isFalse();
    }

    @Test
    void tryAcquire_shouldTimeOut_whenAnotherThreadHoldsTheKey() throws Exception {
        DistributedLock.LockHandle held = lock.tryAcquire("app:hr", Duration.ofMillis(100)).orElseThrow();
        try {
            boolean acquired = CompletableFuture
                .supplyAsync(() -> lock.tryAcquire("app:hr", Duration.ofMillis(50)).isPresent())
                .get(5, TimeUnit.SECONDS);
            boolean otherKey = CompletableFuture
                .supplyAsync(() -> lock.withLock("app:crm", Duration.ofMillis(50), () -> { }))
                .get(5, TimeUnit.SECONDS);

            assertThat(acquired).isFalse();
            assertThat(otherKey).isTrue();
        } finally {
            held.release();
        }
    }

    @Test
    void withLock_shouldReleaseAfterTaskFailure() {
        assertThatThrownBy(() -> lock.withLock("app:hr", Duration.ofMillis(100), (Runnable) () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(lock.isLocked("app:hr")).isFalse();
    }

    @Test
    void release_shouldBeIdempotent() {
        DistributedLock.LockHandle handle = lock.tryAcquire("app:hr", Duration.ofMillis(100)).orElseThrow();

        handle.release();
        handle.close();

        assertThat(lock.isLocked("app:hr")).isFalse();
        assertThat(lock.withLock("app:hr", Duration.ofMillis(100), () -> "ok")).contains("ok");
    }

    @Test
    void release_shouldForgetKey_onceNoOneHoldsOrWaitsForIt() throws Exception {
        for (int i = 0; i < 50; i++) {
            lock.withLock("app:" + i, Duration.ofMillis(100), () -> { });
        }
        DistributedLock.LockHandle outer = lock.tryAcquire("app:hr", Duration.ofMillis(100)).orElseThrow();
        DistributedLock.LockHandle inner = lock.tryAcquire("app:hr", Duration.ofMillis(100)).orElseThrow();

        inner.release();
        int whileOuterHeld = lock.trackedKeys();
        outer.release();

        assertThat(whileOuterHeld).isEqualTo(1);
        assertThat(lock.trackedKeys()).isZero();
        boolean reacquired = CompletableFuture
            .supplyAsync(() -> lock.withLock("app:hr", Duration.ofMillis(100), () -> { }))
            .get(5, TimeUnit.SECONDS);
        assertThat(reacquired).isTrue();
        assertThat(lock.trackedKeys()).isZero();
    }

    @Test
    void tryAcquire_shouldKeepMutualExclusion_whileKeysAreEvictedUnderContention() throws Exception {
        int[] counter = new int[1];
        List<CompletableFuture<Void>> workers = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            workers.add(CompletableFuture.runAsync(() -> {
                for (int i = 0; i < 500; i++) {
                    lock.withLock("app:hr", Duration.ofSeconds(5), () -> {
                        counter[0]++;
                    });
                }
            }));
        }

        CompletableFuture.allOf(workers.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

        assertThat(counter[0]).isEqualTo(2000);
        assertThat(lock.trackedKeys()).isZero();
    }
}
