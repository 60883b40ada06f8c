package tech.cids.platform.discovery.retry;

import tech.cids.platform.discovery.DiscoveryErrorType;

import java.time.Duration;

/**
 * What happened on one attempt of a retried call.
 *
 * @param attemptNumber 1-based
 * @param errorType null on success
 * @param nextDelay delay before the following attempt, null when no retry follows
 */
public record AttemptOutcome(
    int attemptNumber,
    boolean success,
    DiscoveryErrorType errorType,
    String errorMessage,
    Duration elapsed,
    Duration nextDelay
) {
}
