package tech.cids.platform.discovery.endpoint;

import java.util.List;

/**
 * Repository interface for DiscoveredEndpoint entities.
 */
public interface DiscoveredEndpointRepository {

    List<DiscoveredEndpoint> findByAppId(String appId);

    /**
     * Replace every endpoint of the application in one transaction.
     */
    void replaceForApp(String appId, List<DiscoveredEndpoint> endpoints);

    long deleteByAppId(String appId);
}
