package tech.cids.platform.role;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Role entities.
 */
public interface RoleRepository {

    // Read operations
    Optional<Role> findByAppIdAndName(String appId, String roleName);
    List<Role> findByAppId(String appId);
    List<Role> findByAppIdAndNames(String appId, Collection<String> roleNames);

    // Write operations
    void persist(Role role);
    void update(Role role);
    void delete(Role role);
    long deleteByAppId(String appId);
}
