package tech.cids.platform.token;

import java.time.Instant;

/**
 * A compact JWS together with the registered claims the signer assigned.
 */
public record SignedToken(String token, String jti, Instant issuedAt, Instant expiresAt) {
}
