package tech.cids.platform.discovery.endpoint;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An endpoint an application published in its last successful discovery.
 */
public class DiscoveredEndpoint {

    public String id;

    public String appId;

    /**
     * Owning service for multi-service descriptions, null otherwise.
     */
    public String serviceName;

    public String method;

    public String path;

    public String operationId;

    public String description;

    public List<String> tags = new ArrayList<>();

    public List<String> requiredRoles = new ArrayList<>();

    public boolean discovered = true;

    public Instant discoveredAt = Instant.now();

    public DiscoveredEndpoint() {
    }
}
