package tech.cids.platform.token;

import java.time.Instant;

/**
 * Tokens handed to a client after login or refresh.
 *
 * @param expiresIn access-token lifetime in seconds
 */
public record TokenPair(
    String accessToken,
    String tokenType,
    long expiresIn,
    Instant accessTokenExpiresAt,
    String refreshToken,
    Instant refreshTokenExpiresAt
) {
    public static final String BEARER = "Bearer";
}
