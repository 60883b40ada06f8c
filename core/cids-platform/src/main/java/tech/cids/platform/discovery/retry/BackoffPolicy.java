package tech.cids.platform.discovery.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with bounded jitter.
 *
 * <p>{@code nextDelay(n) = min(base * factor^n, maxDelay) + jitter}, where jitter is
 * {@code [0, jitterRatio)} of the capped delay. The only source of randomness is the
 * injected {@link DoubleSupplier}, so a fixed supplier makes the policy a pure function.
 */
public final class BackoffPolicy {

    private final Duration baseDelay;
    private final double factor;
    private final Duration maxDelay;
    private final double jitterRatio;
    private final DoubleSupplier jitterSource;

    public BackoffPolicy(Duration baseDelay, double factor, Duration maxDelay, double jitterRatio,
                         DoubleSupplier jitterSource) {
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("Backoff factor must be at least 1.0, got " + factor);
        }
        if (jitterRatio < 0.0) {
            throw new IllegalArgumentException("Jitter ratio must not be negative, got " + jitterRatio);
        }
        this.baseDelay = baseDelay;
        this.factor = factor;
        this.maxDelay = maxDelay;
        this.jitterRatio = jitterRatio;
        this.jitterSource = jitterSource;
    }

    public BackoffPolicy(Duration baseDelay, double factor, Duration maxDelay, double jitterRatio) {
        this(baseDelay, factor, maxDelay, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Capped delay before retry {@code attempt} (0-based), without jitter.
     */
    public Duration baseDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt must not be negative, got " + attempt);
        }
        double millis = baseDelay.toMillis() * Math.pow(factor, attempt);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * Delay before retry {@code attempt} (0-based), jitter included.
     */
    public Duration nextDelay(int attempt) {
        Duration capped = baseDelay(attempt);
        double sample = Math.min(Math.max(jitterSource.getAsDouble(), 0.0), 1.0);
        long jitter = (long) (capped.toMillis() * jitterRatio * sample);
        return capped.plusMillis(jitter);
    }

    public Duration maxDelay() {
        return maxDelay;
    }
}
