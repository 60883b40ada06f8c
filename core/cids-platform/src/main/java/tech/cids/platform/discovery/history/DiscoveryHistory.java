package tech.cids.platform.discovery.history;

import java.time.Instant;
import java.util.List;

/**
 * Read view over an application's recent discovery attempts.
 *
 * @param attempts newest first
 * @param successRate successful attempts divided by attempts, 0 when there are none
 */
public record DiscoveryHistory(
    String appId,
    List<DiscoveryAttempt> attempts,
    int totalAttempts,
    int successfulAttempts,
    double successRate,
    Instant lastSuccessAt,
    Instant lastFailureAt
) {

    public static DiscoveryHistory of(String appId, List<DiscoveryAttempt> attempts) {
        int successes = 0;
        Instant lastSuccess = null;
        Instant lastFailure = null;
        for (DiscoveryAttempt attempt : attempts) {
            if (attempt.success) {
                successes++;
                if (lastSuccess == null || attempt.timestamp.isAfter(lastSuccess)) {
                    lastSuccess = attempt.timestamp;
                }
            } else if (lastFailure == null || attempt.timestamp.isAfter(lastFailure)) {
                lastFailure = attempt.timestamp;
            }
        }
        double rate = attempts.isEmpty() ? 0.0 : (double) successes / attempts.size();
        return new DiscoveryHistory(appId, List.copyOf(attempts), attempts.size(), successes, rate,
            lastSuccess, lastFailure);
    }
}
