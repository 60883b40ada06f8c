package tech.cids.platform.discovery;

/**
 * How a discovery call was answered.
 */
public enum DiscoveryStatus {
    SUCCESS,
    /** Served from the result cache without a network call. */
    CACHED,
    FAILED
}
