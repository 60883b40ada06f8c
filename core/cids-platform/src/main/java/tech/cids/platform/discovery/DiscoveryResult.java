package tech.cids.platform.discovery;

import java.time.Instant;

/**
 * Outcome of one discovery call.
 *
 * @param discoveryRunId null when the call failed before a run started
 * @param version capability document version, null on failure
 * @param attempts attempts made by the run; for a cached result, those of the run that produced it
 * @param errorType null unless {@code status} is FAILED
 */
public record DiscoveryResult(
    String appId,
    DiscoveryStatus status,
    String discoveryRunId,
    String version,
    int endpointsFound,
    int permissionsGenerated,
    int serviceCount,
    int attempts,
    DiscoveryErrorType errorType,
    String errorMessage,
    Instant completedAt
) {

    public static DiscoveryResult success(String appId, String discoveryRunId, String version, int endpointsFound,
                                          int permissionsGenerated, int serviceCount, int attempts,
                                          Instant completedAt) {
        return new DiscoveryResult(appId, DiscoveryStatus.SUCCESS, discoveryRunId, version, endpointsFound,
            permissionsGenerated, serviceCount, attempts, null, null, completedAt);
    }

    public static DiscoveryResult failed(String appId, String discoveryRunId, DiscoveryErrorType errorType,
                                         String errorMessage, int attempts, Instant completedAt) {
        return new DiscoveryResult(appId, DiscoveryStatus.FAILED, discoveryRunId, null, 0, 0, 0, attempts,
            errorType, errorMessage, completedAt);
    }

    /**
     * The same result, re-labelled as served from cache.
     */
    public DiscoveryResult asCached() {
        return new DiscoveryResult(appId, DiscoveryStatus.CACHED, discoveryRunId, version, endpointsFound,
            permissionsGenerated, serviceCount, attempts, errorType, errorMessage, completedAt);
    }

    public boolean isSuccessful() {
        return status != DiscoveryStatus.FAILED;
    }
}
