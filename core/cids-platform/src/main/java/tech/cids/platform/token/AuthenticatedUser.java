package tech.cids.platform.token;

import java.util.List;

/**
 * A user the identity provider has authenticated, as seen at token issuance.
 *
 * @param groups group display names reported by the identity provider
 * @param clientIp when set, tokens are bound to this address
 * @param deviceFingerprint when set, tokens are bound to this device
 */
public record AuthenticatedUser(
    String subject,
    String email,
    String name,
    List<String> groups,
    String clientIp,
    String deviceFingerprint
) {
    public AuthenticatedUser {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject is required");
        }
        groups = groups != null ? List.copyOf(groups) : List.of();
    }

    public static AuthenticatedUser of(String subject, String email, String name, List<String> groups) {
        return new AuthenticatedUser(subject, email, name, groups, null, null);
    }
}
