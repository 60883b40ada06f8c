package tech.cids.platform.discovery.retry;

import org.jboss.logging.Logger;
import tech.cids.platform.discovery.DiscoveryErrorType;
import tech.cids.platform.discovery.DiscoveryException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Runs a call, retrying classified failures according to a {@link BackoffPolicy}.
 *
 * <p>Terminal error types ({@link DiscoveryErrorType#isRetryable()} false) are rethrown
 * after one attempt. Retryable failures are retried up to {@code maxRetries} times. A retry
 * whose wait would end past the deadline is not started; the call fails with a timeout instead.
 * An interrupted caller gets no further attempts.
 */
public class RetryExecutor {

    private static final Logger LOG = Logger.getLogger(RetryExecutor.class);

    /**
     * One attempt of the retried call.
     */
    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attemptNumber) throws DiscoveryException;
    }

    private final BackoffPolicy backoffPolicy;
    private final int maxRetries;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryExecutor(BackoffPolicy backoffPolicy, int maxRetries, Sleeper sleeper, Clock clock) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative, got " + maxRetries);
        }
        this.backoffPolicy = backoffPolicy;
        this.maxRetries = maxRetries;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * @param label used in log lines
     * @param deadline no retry is started that would wait beyond this instant; null for none
     * @param listener receives every attempt's outcome, in order
     */
    public <T> T execute(String label, Attempt<T> attempt, Instant deadline, Consumer<AttemptOutcome> listener)
            throws DiscoveryException {
        int attemptNumber = 1;
        while (true) {
            Instant started = clock.instant();
            try {
                T result = attempt.run(attemptNumber);
                listener.accept(new AttemptOutcome(attemptNumber, true, null, null,
                    Duration.between(started, clock.instant()), null));
                return result;
            } catch (DiscoveryException e) {
                Duration elapsed = Duration.between(started, clock.instant());
                boolean canRetry = e.isRetryable() && attemptNumber <= maxRetries;
                Duration delay = canRetry ? backoffPolicy.nextDelay(attemptNumber - 1) : null;

                if (canRetry && deadline != null && clock.instant().plus(delay).isAfter(deadline)) {
                    listener.accept(new AttemptOutcome(attemptNumber, false, e.getErrorType(), e.getMessage(),
                        elapsed, null));
                    throw new DiscoveryException(DiscoveryErrorType.TIMEOUT_ERROR,
                        label + ": task deadline reached after " + attemptNumber + " attempts (last error: "
                            + e.getMessage() + ")", e);
                }

                listener.accept(new AttemptOutcome(attemptNumber, false, e.getErrorType(), e.getMessage(),
                    elapsed, delay));

                if (canRetry && Thread.currentThread().isInterrupted()) {
                    throw new DiscoveryException(DiscoveryErrorType.TIMEOUT_ERROR,
                        label + ": cancelled after attempt " + attemptNumber, e);
                }
                if (!canRetry) {
                    if (!e.isRetryable()) {
                        LOG.debugf("%s: %s is not retryable, giving up after attempt %d",
                            label, e.getErrorType(), attemptNumber);
                    }
                    throw e;
                }

                LOG.warnf("%s: attempt %d failed with %s (%s), retrying in %d ms",
                    label, attemptNumber, e.getErrorType(), e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new DiscoveryException(DiscoveryErrorType.TIMEOUT_ERROR,
                        label + ": cancelled while waiting to retry", ie);
                }
                attemptNumber++;
            }
        }
    }

    public int maxRetries() {
        return maxRetries;
    }
}
