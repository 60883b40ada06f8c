package tech.cids.platform.permission.mapper;

import tech.cids.platform.permission.PermissionMetadata;
import tech.cids.platform.permission.entity.PermissionCatalogEntryEntity;

/**
 * Mapper between PermissionMetadata and its catalog row.
 */
public final class PermissionCatalogMapper {

    private PermissionCatalogMapper() {
    }

    public static PermissionMetadata toDomain(PermissionCatalogEntryEntity entity) {
        if (entity == null) {
            return null;
        }
        return new PermissionMetadata(
            entity.permissionKey,
            entity.resource,
            entity.action,
            entity.fieldPath,
            entity.description,
            entity.sensitive,
            entity.pii,
            entity.phi,
            entity.financial,
            entity.sourceEndpointId,
            entity.discoveryRunId,
            entity.discoveredAt
        );
    }

    public static PermissionCatalogEntryEntity toEntity(String appId, PermissionMetadata domain) {
        if (domain == null) {
            return null;
        }
        PermissionCatalogEntryEntity entity = new PermissionCatalogEntryEntity();
        entity.permissionKey = domain.permissionKey();
        entity.appId = appId;
        entity.resource = domain.resource();
        entity.action = domain.action();
        entity.fieldPath = domain.fieldPath();
        entity.description = domain.description();
        entity.sensitive = domain.sensitive();
        entity.pii = domain.pii();
        entity.phi = domain.phi();
        entity.financial = domain.financial();
        entity.sourceEndpointId = domain.sourceEndpointId();
        entity.discoveryRunId = domain.discoveryRunId();
        entity.discoveredAt = domain.discoveredAt();
        return entity;
    }
}
