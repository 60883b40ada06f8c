package tech.cids.platform.token.refresh;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.cids.platform.common.UnitOfWork;
import tech.cids.platform.shared.EntityType;
import tech.cids.platform.shared.TsidGenerator;
import tech.cids.platform.token.AuthenticatedUser;
import tech.cids.platform.token.TokenConfig;
import tech.cids.platform.token.TokenValidationException;
import tech.cids.platform.token.TokenValidationException.Reason;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Objects;

/**
 * Issues, rotates and revokes refresh tokens.
 *
 * <p>Rotation is single-use: the presented token is revoked in the same transaction that stores
 * its successor. A token presented after it was rotated or revoked is treated as stolen, and
 * every token of its family is revoked.
 */
@ApplicationScoped
public class RefreshTokenService {

    private static final Logger LOG = Logger.getLogger(RefreshTokenService.class);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    @Inject
    RefreshTokenRepository refreshTokenRepository;

    @Inject
    UnitOfWork unitOfWork;

    @Inject
    TokenConfig config;

    Clock clock = Clock.systemUTC();

    /**
     * Start a new token family for a login.
     */
    public IssuedRefreshToken issue(AuthenticatedUser user, String targetAppId) {
        RefreshToken record = new RefreshToken();
        record.subject = user.subject();
        record.email = user.email();
        record.name = user.name();
        record.groups = new ArrayList<>(user.groups());
        record.targetAppId = targetAppId;
        record.boundIp = user.clientIp();
        record.boundDevice = user.deviceFingerprint();
        record.familyId = TsidGenerator.generate(EntityType.TOKEN_FAMILY);

        IssuedRefreshToken issued = store(record);
        LOG.debugf("Issued refresh token family %s for %s", record.familyId, user.subject());
        return issued;
    }

    /**
     * Exchange a refresh token for its successor.
     *
     * @return the successor; its record carries the identity the access token is recomposed from
     * @throws TokenValidationException UNKNOWN_TOKEN, EXPIRED, BINDING_MISMATCH or REPLAY_DETECTED
     */
    public IssuedRefreshToken rotate(String token, String clientIp, String deviceFingerprint) {
        if (token == null || token.isBlank()) {
            throw new TokenValidationException(Reason.UNKNOWN_TOKEN, "Refresh token is required");
        }
        String tokenHash = hashToken(token);
        RefreshToken current = refreshTokenRepository.findByTokenHash(tokenHash)
            .orElseThrow(() -> new TokenValidationException(Reason.UNKNOWN_TOKEN, "Unknown refresh token"));

        if (current.revoked) {
            throw replayDetected(current);
        }
        if (current.isExpired(clock.instant())) {
            throw new TokenValidationException(Reason.EXPIRED, "Refresh token has expired");
        }
        checkBinding(current, clientIp, deviceFingerprint);

        RefreshToken next = new RefreshToken();
        next.subject = current.subject;
        next.email = current.email;
        next.name = current.name;
        next.groups = new ArrayList<>(current.groups);
        next.targetAppId = current.targetAppId;
        next.boundIp = current.boundIp;
        next.boundDevice = current.boundDevice;
        next.familyId = current.familyId;
        next.parentTokenHash = tokenHash;

        String nextToken = generateToken();
        next.tokenHash = hashToken(nextToken);
        boolean rotated = unitOfWork.inTransaction(() -> {
            if (!refreshTokenRepository.revokeToken(tokenHash, next.tokenHash)) {
                return false;
            }
            stamp(next);
            refreshTokenRepository.persist(next);
            return true;
        });
        if (!rotated) {
            // lost a race with another use of the same token
            throw replayDetected(current);
        }

        LOG.debugf("Rotated refresh token in family %s for %s", current.familyId, current.subject);
        return new IssuedRefreshToken(nextToken, next);
    }

    /**
     * @return false when the token is unknown or already revoked
     */
    public boolean revoke(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        boolean revoked = unitOfWork.inTransaction(() -> refreshTokenRepository.revokeToken(hashToken(token), null));
        if (revoked) {
            LOG.debug("Revoked refresh token");
        }
        return revoked;
    }

    public int revokeAllForSubject(String subject) {
        int revoked = unitOfWork.inTransaction(() -> refreshTokenRepository.revokeAllForSubject(subject));
        LOG.infof("Revoked %d refresh token(s) for %s", revoked, subject);
        return revoked;
    }

    public long cleanupExpired() {
        long deleted = unitOfWork.inTransaction(() -> refreshTokenRepository.deleteExpired(clock.instant()));
        if (deleted > 0) {
            LOG.infof("Deleted %d expired refresh token(s)", deleted);
        }
        return deleted;
    }

    private IssuedRefreshToken store(RefreshToken record) {
        String token = generateToken();
        record.tokenHash = hashToken(token);
        stamp(record);
        unitOfWork.inTransaction(() -> refreshTokenRepository.persist(record));
        return new IssuedRefreshToken(token, record);
    }

    private void stamp(RefreshToken record) {
        record.issuedAt = clock.instant();
        record.expiresAt = record.issuedAt.plus(config.refresh().lifetime());
    }

    private TokenValidationException replayDetected(RefreshToken token) {
        int revoked = unitOfWork.inTransaction(() -> refreshTokenRepository.revokeTokenFamily(token.familyId));
        LOG.errorf("SECURITY: refresh token reuse detected for %s; revoked %d token(s) in family %s",
            token.subject, revoked, token.familyId);
        return new TokenValidationException(Reason.REPLAY_DETECTED,
            "Refresh token was already used; all tokens of this session are revoked");
    }

    private static void checkBinding(RefreshToken token, String clientIp, String deviceFingerprint) {
        if (token.boundIp != null && !Objects.equals(token.boundIp, clientIp)) {
            LOG.warnf("Refresh token for %s presented from %s, bound to %s", token.subject, clientIp, token.boundIp);
            throw new TokenValidationException(Reason.BINDING_MISMATCH, "Refresh token is bound to another client address");
        }
        if (token.boundDevice != null && !Objects.equals(token.boundDevice, deviceFingerprint)) {
            LOG.warnf("Refresh token for %s presented from an unbound device", token.subject);
            throw new TokenValidationException(Reason.BINDING_MISMATCH, "Refresh token is bound to another device");
        }
    }

    static String generateToken() {
        byte[] bytes = new byte[32];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    static String hashToken(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
