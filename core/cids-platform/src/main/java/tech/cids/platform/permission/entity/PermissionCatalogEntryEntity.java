package tech.cids.platform.permission.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for permission_catalog table.
 */
@Entity
@Table(name = "permission_catalog", indexes = {
    @Index(name = "idx_permission_catalog_app", columnList = "app_id"),
    @Index(name = "idx_permission_catalog_resource", columnList = "app_id, resource, action")
})
public class PermissionCatalogEntryEntity {

    @Id
    @Column(name = "permission_key", length = 512)
    public String permissionKey;

    @Column(name = "app_id", nullable = false, length = 100)
    public String appId;

    @Column(name = "resource", nullable = false)
    public String resource;

    @Column(name = "action", nullable = false, length = 50)
    public String action;

    @Column(name = "field_path", nullable = false, length = 512)
    public String fieldPath;

    @Column(name = "description", columnDefinition = "TEXT")
    public String description;

    @Column(name = "sensitive", nullable = false)
    public boolean sensitive;

    @Column(name = "pii", nullable = false)
    public boolean pii;

    @Column(name = "phi", nullable = false)
    public boolean phi;

    @Column(name = "financial", nullable = false)
    public boolean financial;

    @Column(name = "source_endpoint_id")
    public String sourceEndpointId;

    @Column(name = "discovery_run_id", length = 17)
    public String discoveryRunId;

    @Column(name = "discovered_at", nullable = false)
    public Instant discoveredAt;

    public PermissionCatalogEntryEntity() {
    }
}
