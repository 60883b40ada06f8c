package tech.cids.platform.token;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonString;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;
import tech.cids.platform.token.TokenValidationException.Reason;
import tech.cids.platform.token.refresh.IssuedRefreshToken;
import tech.cids.platform.token.refresh.RefreshToken;
import tech.cids.platform.token.refresh.RefreshTokenService;
import tech.cids.platform.token.revocation.RevocationReason;
import tech.cids.platform.token.revocation.RevocationService;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Token lifecycle: issue, refresh, validate and revoke.
 *
 * <p>Access tokens are recomposed from persisted role state on every issue and refresh, so a
 * role change reaches the user at the next refresh at the latest.
 */
@ApplicationScoped
public class TokenService {

    private static final Logger LOG = Logger.getLogger(TokenService.class);

    @Inject
    ClaimsComposer claimsComposer;

    @Inject
    TokenSigner tokenSigner;

    @Inject
    RefreshTokenService refreshTokenService;

    @Inject
    RevocationService revocationService;

    @Inject
    TokenConfig config;

    /**
     * Issue an access token and start a new refresh token family.
     *
     * @param targetAppId restrict the access token to one application; null for all
     */
    public TokenPair issueTokens(AuthenticatedUser user, String targetAppId) {
        SignedToken access = signAccessToken(user, targetAppId);
        IssuedRefreshToken refresh = refreshTokenService.issue(user, targetAppId);
        LOG.infof("Issued tokens for %s (target %s, access token %s)",
            user.subject(), targetAppId != null ? targetAppId : "all", access.jti());
        return toPair(access, refresh);
    }

    /**
     * Rotate the refresh token and issue an access token from the current role state.
     *
     * @throws TokenValidationException when the refresh token is unknown, expired, bound
     *         elsewhere or replayed
     */
    public TokenPair refresh(String refreshToken, String clientIp, String deviceFingerprint) {
        IssuedRefreshToken next = refreshTokenService.rotate(refreshToken, clientIp, deviceFingerprint);
        RefreshToken record = next.record();
        AuthenticatedUser user = new AuthenticatedUser(
            record.subject, record.email, record.name, record.groups, record.boundIp, record.boundDevice);

        SignedToken access = signAccessToken(user, record.targetAppId);
        LOG.infof("Refreshed tokens for %s (access token %s)", user.subject(), access.jti());
        return toPair(access, next);
    }

    /**
     * Verify an access token.
     *
     * @param clientIp address the token is presented from; checked when the token is IP-bound
     * @param deviceFingerprint device the token is presented from; checked when device-bound
     * @throws TokenValidationException INVALID, EXPIRED, REVOKED or BINDING_MISMATCH
     */
    public ValidatedToken validate(String accessToken, String clientIp, String deviceFingerprint) {
        JsonWebToken jwt = tokenSigner.verify(accessToken);

        if (jwt.getTokenID() == null || revocationService.isRevoked(jwt.getTokenID())) {
            LOG.debugf("Rejected revoked access token %s of %s", jwt.getTokenID(), jwt.getSubject());
            throw new TokenValidationException(Reason.REVOKED, "Token has been revoked");
        }

        String boundIp = stringClaim(jwt, ClaimsComposer.CLAIM_BOUND_IP);
        if (boundIp != null && !Objects.equals(boundIp, clientIp)) {
            LOG.warnf("Access token %s of %s presented from %s, bound to %s",
                jwt.getTokenID(), jwt.getSubject(), clientIp, boundIp);
            throw new TokenValidationException(Reason.BINDING_MISMATCH, "Token is bound to another client address");
        }
        String boundDevice = stringClaim(jwt, ClaimsComposer.CLAIM_BOUND_DEVICE);
        if (boundDevice != null && !Objects.equals(boundDevice, deviceFingerprint)) {
            LOG.warnf("Access token %s of %s presented from an unbound device", jwt.getTokenID(), jwt.getSubject());
            throw new TokenValidationException(Reason.BINDING_MISMATCH, "Token is bound to another device");
        }

        return new ValidatedToken(jwt.getSubject(), jwt.getTokenID(),
            Instant.ofEpochSecond(jwt.getExpirationTime()), jwt);
    }

    /**
     * Revoke an access token before it expires.
     *
     * @return false when the token has already expired
     * @throws TokenValidationException when the token is not one of ours
     */
    public boolean revoke(String accessToken) {
        JsonWebToken jwt;
        try {
            jwt = tokenSigner.verify(accessToken);
        } catch (TokenValidationException e) {
            if (e.getReason() == Reason.EXPIRED) {
                LOG.debug("Revocation of an expired access token ignored");
                return false;
            }
            throw e;
        }
        revocationService.revoke(jwt.getTokenID(), jwt.getSubject(),
            Instant.ofEpochSecond(jwt.getExpirationTime()), RevocationReason.LOGOUT);
        return true;
    }

    /**
     * Revoke every refresh token of the subject. Access tokens already issued stay valid until
     * they expire.
     */
    public int revokeAllForSubject(String subject) {
        return refreshTokenService.revokeAllForSubject(subject);
    }

    public CleanupResult cleanupExpired() {
        CleanupResult result = new CleanupResult(
            refreshTokenService.cleanupExpired(), revocationService.cleanupExpired());
        LOG.debugf("Token cleanup: %d refresh tokens, %d revocations deleted",
            result.refreshTokensDeleted(), result.revocationsDeleted());
        return result;
    }

    private SignedToken signAccessToken(AuthenticatedUser user, String targetAppId) {
        Map<String, Object> claims = claimsComposer.composeClaims(user, targetAppId);
        return tokenSigner.sign(claims, config.jwt().accessTokenTtl());
    }

    private TokenPair toPair(SignedToken access, IssuedRefreshToken refresh) {
        long expiresIn = Duration.between(access.issuedAt(), access.expiresAt()).getSeconds();
        return new TokenPair(access.token(), TokenPair.BEARER, expiresIn, access.expiresAt(),
            refresh.token(), refresh.record().expiresAt);
    }

    static String stringClaim(JsonWebToken jwt, String name) {
        Object value = jwt.getClaim(name);
        if (value == null) {
            return null;
        }
        if (value instanceof JsonString json) {
            return json.getString();
        }
        return value.toString();
    }
}
