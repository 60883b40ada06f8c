package tech.cids.platform.permission;

import tech.cids.platform.role.FilterClause;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Administrator input for creating or updating a role.
 *
 * @param active null keeps the current flag on update and means active on create
 */
public record RoleRequest(
    String roleName,
    Set<String> allowedPermissions,
    Set<String> deniedPermissions,
    Map<String, Map<String, List<FilterClause>>> rlsFilters,
    String description,
    Boolean active
) {
    public RoleRequest {
        allowedPermissions = allowedPermissions != null ? allowedPermissions : Set.of();
        deniedPermissions = deniedPermissions != null ? deniedPermissions : Set.of();
        rlsFilters = rlsFilters != null ? rlsFilters : Map.of();
    }

    public static RoleRequest of(String roleName, Set<String> allowedPermissions) {
        return new RoleRequest(roleName, allowedPermissions, Set.of(), Map.of(), null, null);
    }
}
