package tech.cids.platform.token.refresh.mapper;

import tech.cids.platform.token.refresh.RefreshToken;
import tech.cids.platform.token.refresh.entity.RefreshTokenEntity;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * Mapper for converting between RefreshToken domain model and JPA entity.
 */
public final class RefreshTokenMapper {

    private RefreshTokenMapper() {
    }

    public static RefreshToken toDomain(RefreshTokenEntity entity) {
        if (entity == null) {
            return null;
        }

        RefreshToken domain = new RefreshToken();
        domain.tokenHash = entity.tokenHash;
        domain.subject = entity.subject;
        domain.familyId = entity.familyId;
        domain.parentTokenHash = entity.parentTokenHash;
        domain.email = entity.email;
        domain.name = entity.name;
        domain.groups = entity.groups != null ? new ArrayList<>(Arrays.asList(entity.groups)) : new ArrayList<>();
        domain.targetAppId = entity.targetAppId;
        domain.boundIp = entity.boundIp;
        domain.boundDevice = entity.boundDevice;
        domain.revoked = entity.revoked;
        domain.revokedAt = entity.revokedAt;
        domain.replacedBy = entity.replacedBy;
        domain.issuedAt = entity.issuedAt;
        domain.expiresAt = entity.expiresAt;
        return domain;
    }

    public static RefreshTokenEntity toEntity(RefreshToken domain) {
        if (domain == null) {
            return null;
        }

        RefreshTokenEntity entity = new RefreshTokenEntity();
        entity.tokenHash = domain.tokenHash;
        entity.subject = domain.subject;
        entity.familyId = domain.familyId;
        entity.parentTokenHash = domain.parentTokenHash;
        entity.email = domain.email;
        entity.name = domain.name;
        entity.groups = domain.groups != null ? domain.groups.toArray(new String[0]) : new String[0];
        entity.targetAppId = domain.targetAppId;
        entity.boundIp = domain.boundIp;
        entity.boundDevice = domain.boundDevice;
        entity.revoked = domain.revoked;
        entity.revokedAt = domain.revokedAt;
        entity.replacedBy = domain.replacedBy;
        entity.issuedAt = domain.issuedAt;
        entity.expiresAt = domain.expiresAt;
        return entity;
    }
}
