package tech.cids.platform.token.revocation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import tech.cids.platform.token.revocation.RevocationReason;

import java.time.Instant;

/**
 * JPA entity for revoked_tokens table.
 */
@Entity
@Table(name = "revoked_tokens", indexes = {
    @Index(name = "idx_revoked_tokens_subject", columnList = "subject"),
    @Index(name = "idx_revoked_tokens_expires_at", columnList = "expires_at")
})
public class RevokedTokenEntity {

    @Id
    @Column(name = "jti", length = 64)
    public String jti;

    @Column(name = "subject")
    public String subject;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 32)
    public RevocationReason reason;

    @Column(name = "revoked_at", nullable = false)
    public Instant revokedAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    public RevokedTokenEntity() {
    }
}
