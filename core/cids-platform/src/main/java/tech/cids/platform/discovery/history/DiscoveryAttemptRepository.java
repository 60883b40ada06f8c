package tech.cids.platform.discovery.history;

import java.util.List;

/**
 * Append-only attempt log, bounded per application.
 */
public interface DiscoveryAttemptRepository {

    /**
     * Newest first.
     */
    List<DiscoveryAttempt> findRecent(String appId, int limit);

    /**
     * Append an attempt and drop the application's oldest entries beyond {@code keep}.
     */
    void append(DiscoveryAttempt attempt, int keep);

    long deleteByAppId(String appId);
}
