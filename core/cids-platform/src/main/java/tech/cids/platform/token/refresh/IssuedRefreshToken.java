package tech.cids.platform.token.refresh;

/**
 * A freshly issued refresh token: the plain value handed to the client and the stored record.
 */
public record IssuedRefreshToken(String token, RefreshToken record) {
}
