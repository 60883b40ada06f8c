package tech.cids.platform.token;

import org.eclipse.microprofile.jwt.JsonWebToken;

import java.time.Duration;
import java.util.Map;

/**
 * Signing boundary. Callers hand over finished claims; the signer adds {@code iss}, {@code iat},
 * {@code nbf}, {@code exp} and {@code jti}, and {@code aud} when the claims carry none.
 */
public interface TokenSigner {

    SignedToken sign(Map<String, Object> claims, Duration ttl);

    /**
     * Verify signature, issuer and lifetime.
     *
     * @throws TokenValidationException with reason EXPIRED or INVALID
     */
    JsonWebToken verify(String token);
}
