package tech.cids.platform.token.refresh.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * JPA entity for refresh_tokens table.
 */
@Entity
@Table(name = "refresh_tokens", indexes = {
    @Index(name = "idx_refresh_tokens_subject", columnList = "subject"),
    @Index(name = "idx_refresh_tokens_family", columnList = "family_id"),
    @Index(name = "idx_refresh_tokens_expires_at", columnList = "expires_at")
})
public class RefreshTokenEntity {

    @Id
    @Column(name = "token_hash", length = 64)
    public String tokenHash;

    @Column(name = "subject", nullable = false)
    public String subject;

    @Column(name = "family_id", nullable = false, length = 17)
    public String familyId;

    @Column(name = "parent_token_hash", length = 64)
    public String parentTokenHash;

    @Column(name = "email")
    public String email;

    @Column(name = "name")
    public String name;

    @Column(name = "group_names", columnDefinition = "TEXT[]")
    @JdbcTypeCode(SqlTypes.ARRAY)
    public String[] groups;

    @Column(name = "target_app_id")
    public String targetAppId;

    @Column(name = "bound_ip", length = 45)
    public String boundIp;

    @Column(name = "bound_device")
    public String boundDevice;

    @Column(name = "revoked", nullable = false)
    public boolean revoked;

    @Column(name = "revoked_at")
    public Instant revokedAt;

    @Column(name = "replaced_by", length = 64)
    public String replacedBy;

    @Column(name = "issued_at", nullable = false)
    public Instant issuedAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    public RefreshTokenEntity() {
    }
}
