package tech.cids.platform.permission.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.cids.platform.permission.PermissionCatalogRepository;
import tech.cids.platform.permission.PermissionMetadata;
import tech.cids.platform.permission.entity.PermissionCatalogEntryEntity;
import tech.cids.platform.permission.mapper.PermissionCatalogMapper;

import java.util.Collection;
import java.util.List;

/**
 * Panache-based implementation of PermissionCatalogRepository.
 */
@ApplicationScoped
public class PanachePermissionCatalogRepository
    implements PermissionCatalogRepository, PanacheRepositoryBase<PermissionCatalogEntryEntity, String> {

    @Override
    public List<PermissionMetadata> findByAppId(String appId) {
        return find("appId = ?1 order by permissionKey", appId)
            .list()
            .stream()
            .map(PermissionCatalogMapper::toDomain)
            .toList();
    }

    @Override
    public List<String> findAppIds() {
        return getEntityManager()
            .createQuery("SELECT DISTINCT e.appId FROM PermissionCatalogEntryEntity e ORDER BY e.appId", String.class)
            .getResultList();
    }

    @Override
    public void replaceCatalog(String appId, Collection<PermissionMetadata> permissions) {
        delete("appId", appId);
        // Flush deletes before re-inserting rows that share primary keys
        flush();
        persist(permissions.stream().map(p -> PermissionCatalogMapper.toEntity(appId, p)));
    }

    @Override
    public long deleteByAppId(String appId) {
        return delete("appId", appId);
    }
}
