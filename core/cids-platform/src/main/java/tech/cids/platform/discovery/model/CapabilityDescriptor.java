package tech.cids.platform.discovery.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The validated capability description an application published.
 *
 * <p>Exactly one of {@code endpoints} and {@code services} is non-null. Instances are
 * immutable and the next successful discovery run supersedes them.
 */
public record CapabilityDescriptor(
    String appId,
    String appName,
    String version,
    String description,
    List<Endpoint> endpoints,
    List<ServiceDescriptor> services
) {
    public static final String CURRENT_VERSION = "2.0";

    public CapabilityDescriptor {
        endpoints = endpoints != null ? List.copyOf(endpoints) : null;
        services = services != null ? List.copyOf(services) : null;
        if ((endpoints == null) == (services == null)) {
            throw new IllegalArgumentException("Exactly one of endpoints or services must be set");
        }
    }

    public boolean isMultiService() {
        return services != null;
    }

    /**
     * All endpoints, flattened across services.
     */
    public List<Endpoint> allEndpoints() {
        if (endpoints != null) {
            return endpoints;
        }
        List<Endpoint> all = new ArrayList<>();
        for (ServiceDescriptor service : services) {
            all.addAll(service.endpoints());
        }
        return all;
    }

    public int serviceCount() {
        return services != null ? services.size() : 0;
    }
}
