package tech.cids.platform.application.mapper;

import tech.cids.platform.application.RegisteredApplication;
import tech.cids.platform.application.entity.RegisteredApplicationEntity;

/**
 * Mapper for converting between RegisteredApplication domain model and JPA entity.
 */
public final class RegisteredApplicationMapper {

    private RegisteredApplicationMapper() {
    }

    public static RegisteredApplication toDomain(RegisteredApplicationEntity entity) {
        if (entity == null) {
            return null;
        }

        RegisteredApplication domain = new RegisteredApplication();
        domain.id = entity.id;
        domain.appId = entity.appId;
        domain.name = entity.name;
        domain.description = entity.description;
        domain.discoveryUrl = entity.discoveryUrl;
        domain.allowDiscovery = entity.allowDiscovery;
        domain.active = entity.active;
        domain.discoveryStatus = entity.discoveryStatus != null
            ? entity.discoveryStatus
            : RegisteredApplication.STATUS_NEVER_RUN;
        domain.lastDiscoveryAt = entity.lastDiscoveryAt;
        domain.discoveryVersion = entity.discoveryVersion;
        domain.discoveryRunCount = entity.discoveryRunCount;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static RegisteredApplicationEntity toEntity(RegisteredApplication domain) {
        if (domain == null) {
            return null;
        }

        RegisteredApplicationEntity entity = new RegisteredApplicationEntity();
        entity.id = domain.id;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(RegisteredApplicationEntity entity, RegisteredApplication domain) {
        entity.appId = domain.appId;
        entity.name = domain.name;
        entity.description = domain.description;
        entity.discoveryUrl = domain.discoveryUrl;
        entity.allowDiscovery = domain.allowDiscovery;
        entity.active = domain.active;
        entity.discoveryStatus = domain.discoveryStatus;
        entity.lastDiscoveryAt = domain.lastDiscoveryAt;
        entity.discoveryVersion = domain.discoveryVersion;
        entity.discoveryRunCount = domain.discoveryRunCount;
        entity.updatedAt = domain.updatedAt;
    }
}
