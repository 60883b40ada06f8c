package tech.cids.platform.discovery.endpoint.mapper;

import tech.cids.platform.discovery.endpoint.DiscoveredEndpoint;
import tech.cids.platform.discovery.endpoint.entity.DiscoveredEndpointEntity;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * Mapper for converting between DiscoveredEndpoint domain model and JPA entity.
 */
public final class DiscoveredEndpointMapper {

    private DiscoveredEndpointMapper() {
    }

    public static DiscoveredEndpoint toDomain(DiscoveredEndpointEntity entity) {
        if (entity == null) {
            return null;
        }
        DiscoveredEndpoint domain = new DiscoveredEndpoint();
        domain.id = entity.id;
        domain.appId = entity.appId;
        domain.serviceName = entity.serviceName;
        domain.method = entity.method;
        domain.path = entity.path;
        domain.operationId = entity.operationId;
        domain.description = entity.description;
        domain.tags = entity.tags != null ? new ArrayList<>(Arrays.asList(entity.tags)) : new ArrayList<>();
        domain.requiredRoles = entity.requiredRoles != null
            ? new ArrayList<>(Arrays.asList(entity.requiredRoles))
            : new ArrayList<>();
        domain.discovered = entity.discovered;
        domain.discoveredAt = entity.discoveredAt;
        return domain;
    }

    public static DiscoveredEndpointEntity toEntity(DiscoveredEndpoint domain) {
        if (domain == null) {
            return null;
        }
        DiscoveredEndpointEntity entity = new DiscoveredEndpointEntity();
        entity.id = domain.id;
        entity.appId = domain.appId;
        entity.serviceName = domain.serviceName;
        entity.method = domain.method;
        entity.path = domain.path;
        entity.operationId = domain.operationId;
        entity.description = domain.description;
        entity.tags = domain.tags != null ? domain.tags.toArray(new String[0]) : new String[0];
        entity.requiredRoles = domain.requiredRoles != null ? domain.requiredRoles.toArray(new String[0]) : new String[0];
        entity.discovered = domain.discovered;
        entity.discoveredAt = domain.discoveredAt;
        return entity;
    }
}
