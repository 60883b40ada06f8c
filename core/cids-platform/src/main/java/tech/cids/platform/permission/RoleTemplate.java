package tech.cids.platform.permission;

import java.util.List;
import java.util.Map;

/**
 * Starting point for an administrator defining roles: the catalog arranged for reading plus
 * a few suggested roles.
 *
 * @param exampleRoles keyed by suggested role name, in ascending order of reach
 */
public record RoleTemplate(
    String appId,
    Map<String, Map<String, PermissionTreeNode>> permissionsByResource,
    Map<PermissionCategory, List<PermissionMetadata>> sensitivePermissions,
    int totalPermissions,
    Map<String, SuggestedRole> exampleRoles
) {

    public record SuggestedRole(String description, List<String> suggestedPermissions) {
    }
}
