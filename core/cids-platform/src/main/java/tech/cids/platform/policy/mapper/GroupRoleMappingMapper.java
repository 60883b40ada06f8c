package tech.cids.platform.policy.mapper;

import tech.cids.platform.policy.GroupRoleMapping;
import tech.cids.platform.policy.entity.GroupRoleMappingEntity;

/**
 * Mapper for converting between GroupRoleMapping domain model and JPA entity.
 */
public final class GroupRoleMappingMapper {

    private GroupRoleMappingMapper() {
    }

    public static GroupRoleMapping toDomain(GroupRoleMappingEntity entity) {
        if (entity == null) {
            return null;
        }
        GroupRoleMapping domain = new GroupRoleMapping(entity.id, entity.groupName, entity.appId, entity.roleName);
        domain.createdAt = entity.createdAt;
        return domain;
    }

    public static GroupRoleMappingEntity toEntity(GroupRoleMapping domain) {
        if (domain == null) {
            return null;
        }
        GroupRoleMappingEntity entity = new GroupRoleMappingEntity();
        entity.id = domain.id;
        entity.groupName = domain.groupName;
        entity.appId = domain.appId;
        entity.roleName = domain.roleName;
        entity.createdAt = domain.createdAt;
        return entity;
    }
}
