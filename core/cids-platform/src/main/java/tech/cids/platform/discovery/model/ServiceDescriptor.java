package tech.cids.platform.discovery.model;

import java.util.List;

/**
 * A named group of endpoints in a multi-service capability description.
 */
public record ServiceDescriptor(
    String name,
    String version,
    String description,
    String basePath,
    List<Endpoint> endpoints
) {
    public ServiceDescriptor {
        basePath = basePath != null ? basePath : "/";
        endpoints = endpoints != null ? List.copyOf(endpoints) : List.of();
    }
}
