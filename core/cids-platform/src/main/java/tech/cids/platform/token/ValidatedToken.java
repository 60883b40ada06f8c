package tech.cids.platform.token;

import org.eclipse.microprofile.jwt.JsonWebToken;

import java.time.Instant;

/**
 * An access token that passed signature, revocation and binding checks.
 */
public record ValidatedToken(String subject, String jti, Instant expiresAt, JsonWebToken jwt) {

    /**
     * A string claim, or null when absent.
     */
    public String stringClaim(String name) {
        return TokenService.stringClaim(jwt, name);
    }
}
