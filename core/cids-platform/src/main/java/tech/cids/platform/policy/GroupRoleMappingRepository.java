package tech.cids.platform.policy;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for GroupRoleMapping entities.
 */
public interface GroupRoleMappingRepository {

    // Read operations
    List<GroupRoleMapping> findByGroupNames(Collection<String> groupNames);
    List<GroupRoleMapping> findByAppId(String appId);
    Optional<GroupRoleMapping> findMapping(String groupName, String appId, String roleName);

    // Write operations
    void persist(GroupRoleMapping mapping);
    boolean deleteMapping(String groupName, String appId, String roleName);
    long deleteByAppId(String appId);
    long deleteByAppIdAndRoleName(String appId, String roleName);
}
