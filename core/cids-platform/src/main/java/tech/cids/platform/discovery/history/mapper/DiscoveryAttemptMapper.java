package tech.cids.platform.discovery.history.mapper;

import tech.cids.platform.discovery.history.DiscoveryAttempt;
import tech.cids.platform.discovery.history.entity.DiscoveryAttemptEntity;

/**
 * Mapper for converting between DiscoveryAttempt domain model and JPA entity.
 */
public final class DiscoveryAttemptMapper {

    private DiscoveryAttemptMapper() {
    }

    public static DiscoveryAttempt toDomain(DiscoveryAttemptEntity entity) {
        if (entity == null) {
            return null;
        }
        DiscoveryAttempt domain = new DiscoveryAttempt();
        domain.id = entity.id;
        domain.appId = entity.appId;
        domain.discoveryRunId = entity.discoveryRunId;
        domain.timestamp = entity.timestamp;
        domain.success = entity.success;
        domain.errorType = entity.errorType;
        domain.errorMessage = entity.errorMessage;
        domain.responseTimeMs = entity.responseTimeMs;
        domain.endpointsFound = entity.endpointsFound;
        domain.permissionsGenerated = entity.permissionsGenerated;
        domain.attemptNumber = entity.attemptNumber;
        return domain;
    }

    public static DiscoveryAttemptEntity toEntity(DiscoveryAttempt domain) {
        if (domain == null) {
            return null;
        }
        DiscoveryAttemptEntity entity = new DiscoveryAttemptEntity();
        entity.id = domain.id;
        entity.appId = domain.appId;
        entity.discoveryRunId = domain.discoveryRunId;
        entity.timestamp = domain.timestamp;
        entity.success = domain.success;
        entity.errorType = domain.errorType;
        entity.errorMessage = domain.errorMessage;
        entity.responseTimeMs = domain.responseTimeMs;
        entity.endpointsFound = domain.endpointsFound;
        entity.permissionsGenerated = domain.permissionsGenerated;
        entity.attemptNumber = domain.attemptNumber;
        return entity;
    }
}
