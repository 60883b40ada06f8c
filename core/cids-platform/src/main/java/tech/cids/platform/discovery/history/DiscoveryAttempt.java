package tech.cids.platform.discovery.history;

import tech.cids.platform.discovery.DiscoveryErrorType;

import java.time.Instant;

/**
 * One attempt of one discovery run, successful or not.
 */
public class DiscoveryAttempt {

    public String id;

    public String appId;

    /**
     * Groups the attempts made by one call to discover.
     */
    public String discoveryRunId;

    public Instant timestamp = Instant.now();

    public boolean success;

    public DiscoveryErrorType errorType;

    public String errorMessage;

    public long responseTimeMs;

    public int endpointsFound;

    public int permissionsGenerated;

    /**
     * 1-based position of this attempt within its run.
     */
    public int attemptNumber;

    public DiscoveryAttempt() {
    }
}
