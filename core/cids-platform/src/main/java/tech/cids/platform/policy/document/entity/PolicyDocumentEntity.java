package tech.cids.platform.policy.document.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * JPA entity for policy_documents table.
 */
@Entity
@Table(name = "policy_documents")
public class PolicyDocumentEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "policy_id", nullable = false, unique = true, length = 100)
    public String policyId;

    @Column(name = "version", length = 50)
    public String version;

    @Column(name = "description", columnDefinition = "TEXT")
    public String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "role_matrix", columnDefinition = "jsonb")
    public String roleMatrix;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "abac_rules", columnDefinition = "jsonb")
    public String abacRules;

    @Column(name = "active", nullable = false)
    public boolean active;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public PolicyDocumentEntity() {
    }
}
