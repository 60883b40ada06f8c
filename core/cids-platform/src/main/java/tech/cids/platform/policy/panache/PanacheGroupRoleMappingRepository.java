package tech.cids.platform.policy.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.cids.platform.policy.GroupRoleMapping;
import tech.cids.platform.policy.GroupRoleMappingRepository;
import tech.cids.platform.policy.entity.GroupRoleMappingEntity;
import tech.cids.platform.policy.mapper.GroupRoleMappingMapper;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of GroupRoleMappingRepository.
 */
@ApplicationScoped
public class PanacheGroupRoleMappingRepository
    implements GroupRoleMappingRepository, PanacheRepositoryBase<GroupRoleMappingEntity, String> {

    @Override
    public List<GroupRoleMapping> findByGroupNames(Collection<String> groupNames) {
        if (groupNames == null || groupNames.isEmpty()) {
            return List.of();
        }
        return find("groupName in ?1", groupNames)
            .list()
            .stream()
            .map(GroupRoleMappingMapper::toDomain)
            .toList();
    }

    @Override
    public List<GroupRoleMapping> findByAppId(String appId) {
        return find("appId = ?1 order by groupName, roleName", appId)
            .list()
            .stream()
            .map(GroupRoleMappingMapper::toDomain)
            .toList();
    }

    @Override
    public Optional<GroupRoleMapping> findMapping(String groupName, String appId, String roleName) {
        return find("groupName = ?1 and appId = ?2 and roleName = ?3", groupName, appId, roleName)
            .firstResultOptional()
            .map(GroupRoleMappingMapper::toDomain);
    }

    @Override
    public void persist(GroupRoleMapping mapping) {
        persist(GroupRoleMappingMapper.toEntity(mapping));
    }

    @Override
    public boolean deleteMapping(String groupName, String appId, String roleName) {
        return delete("groupName = ?1 and appId = ?2 and roleName = ?3", groupName, appId, roleName) > 0;
    }

    @Override
    public long deleteByAppId(String appId) {
        return delete("appId", appId);
    }

    @Override
    public long deleteByAppIdAndRoleName(String appId, String roleName) {
        return delete("appId = ?1 and roleName = ?2", appId, roleName);
    }
}
