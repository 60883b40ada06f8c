package tech.cids.platform.role.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.cids.platform.role.Role;
import tech.cids.platform.role.RoleRepository;
import tech.cids.platform.role.entity.RoleEntity;
import tech.cids.platform.role.mapper.RoleMapper;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for Role entities.
 * Uses EntityManager directly to return domain objects; writes delegate to {@link RoleWriteRepository}.
 */
@ApplicationScoped
public class RoleReadRepository implements RoleRepository {

    @Inject
    EntityManager em;

    @Inject
    RoleWriteRepository writeRepo;

    @Override
    public Optional<Role> findByAppIdAndName(String appId, String roleName) {
        var results = em.createQuery(
                "FROM RoleEntity WHERE appId = :appId AND roleName = :roleName", RoleEntity.class)
            .setParameter("appId", appId)
            .setParameter("roleName", roleName)
            .getResultList();
        return results.isEmpty() ? Optional.empty() : Optional.of(RoleMapper.toDomain(results.get(0)));
    }

    @Override
    public List<Role> findByAppId(String appId) {
        return em.createQuery("FROM RoleEntity WHERE appId = :appId ORDER BY roleName", RoleEntity.class)
            .setParameter("appId", appId)
            .getResultList()
            .stream()
            .map(RoleMapper::toDomain)
            .toList();
    }

    @Override
    public List<Role> findByAppIdAndNames(String appId, Collection<String> roleNames) {
        if (roleNames == null || roleNames.isEmpty()) {
            return List.of();
        }
        return em.createQuery(
                "FROM RoleEntity WHERE appId = :appId AND roleName IN :roleNames ORDER BY roleName", RoleEntity.class)
            .setParameter("appId", appId)
            .setParameter("roleNames", roleNames)
            .getResultList()
            .stream()
            .map(RoleMapper::toDomain)
            .toList();
    }

    // Write operations delegate to WriteRepository
    @Override
    public void persist(Role role) {
        writeRepo.persistRole(role);
    }

    @Override
    public void update(Role role) {
        writeRepo.updateRole(role);
    }

    @Override
    public void delete(Role role) {
        writeRepo.deleteRoleById(role.id);
    }

    @Override
    public long deleteByAppId(String appId) {
        return writeRepo.deleteRolesByAppId(appId);
    }
}
