package tech.cids.platform.permission;

import java.util.Collection;
import java.util.List;

/**
 * Durable store of discovered permission metadata, one catalog per application.
 */
public interface PermissionCatalogRepository {

    // Read operations
    List<PermissionMetadata> findByAppId(String appId);
    List<String> findAppIds();

    // Write operations

    /**
     * Replace the application's whole catalog. Must run inside the caller's transaction so
     * readers never observe a half-written catalog.
     */
    void replaceCatalog(String appId, Collection<PermissionMetadata> permissions);

    long deleteByAppId(String appId);
}
