package tech.cids.platform.token;

/**
 * Rows removed by one token cleanup pass.
 */
public record CleanupResult(long refreshTokensDeleted, long revocationsDeleted) {
}
