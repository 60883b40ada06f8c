package tech.cids.platform.role.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.cids.platform.role.Role;
import tech.cids.platform.role.entity.RoleEntity;
import tech.cids.platform.role.mapper.RoleMapper;

import java.time.Instant;

/**
 * Write-side repository for Role entities.
 */
@ApplicationScoped
public class RoleWriteRepository implements PanacheRepositoryBase<RoleEntity, String> {

    public void persistRole(Role role) {
        if (role.createdAt == null) {
            role.createdAt = Instant.now();
        }
        role.updatedAt = Instant.now();
        persist(RoleMapper.toEntity(role));
    }

    public void updateRole(Role role) {
        role.updatedAt = Instant.now();
        RoleEntity entity = findById(role.id);
        if (entity != null) {
            RoleMapper.updateEntity(entity, role);
        }
    }

    public boolean deleteRoleById(String id) {
        return deleteById(id);
    }

    public long deleteRolesByAppId(String appId) {
        return delete("appId", appId);
    }
}
