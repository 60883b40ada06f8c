package tech.cids.platform.policy.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * JPA entity for group_role_mappings table.
 */
@Entity
@Table(name = "group_role_mappings",
    uniqueConstraints = @UniqueConstraint(name = "uq_group_role_mappings",
        columnNames = {"group_name", "app_id", "role_name"}),
    indexes = @Index(name = "idx_group_role_mappings_group", columnList = "group_name"))
public class GroupRoleMappingEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "group_name", nullable = false)
    public String groupName;

    @Column(name = "app_id", nullable = false, length = 100)
    public String appId;

    @Column(name = "role_name", nullable = false, length = 100)
    public String roleName;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public GroupRoleMappingEntity() {
    }
}
