package tech.cids.platform.role.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * JPA entity for app_roles table.
 */
@Entity
@Table(name = "app_roles",
    uniqueConstraints = @UniqueConstraint(name = "uq_app_roles_app_name", columnNames = {"app_id", "role_name"}))
public class RoleEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "app_id", nullable = false, length = 100)
    public String appId;

    @Column(name = "role_name", nullable = false, length = 100)
    public String roleName;

    @Column(name = "allowed_permissions", columnDefinition = "TEXT[]")
    @JdbcTypeCode(SqlTypes.ARRAY)
    public String[] allowedPermissions;

    @Column(name = "denied_permissions", columnDefinition = "TEXT[]")
    @JdbcTypeCode(SqlTypes.ARRAY)
    public String[] deniedPermissions;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "rls_filters", columnDefinition = "jsonb")
    public String rlsFilters;

    @Column(name = "description", columnDefinition = "TEXT")
    public String description;

    @Column(name = "active", nullable = false)
    public boolean active;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public RoleEntity() {
    }
}
