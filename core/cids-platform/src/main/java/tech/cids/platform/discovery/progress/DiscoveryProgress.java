package tech.cids.platform.discovery.progress;

import java.time.Instant;

/**
 * Snapshot of where an application's discovery currently is.
 */
public record DiscoveryProgress(
    String appId,
    String discoveryRunId,
    DiscoveryStep step,
    int percentage,
    String message,
    Instant updatedAt
) {
}
