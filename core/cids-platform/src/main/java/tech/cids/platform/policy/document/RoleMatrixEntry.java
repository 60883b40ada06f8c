package tech.cids.platform.policy.document;

import java.util.List;

/**
 * The permissions a policy document assigns to one role of one application.
 */
public record RoleMatrixEntry(
    String appId,
    String roleName,
    List<String> permissions
) {
    public RoleMatrixEntry {
        permissions = permissions != null ? List.copyOf(permissions) : List.of();
    }
}
