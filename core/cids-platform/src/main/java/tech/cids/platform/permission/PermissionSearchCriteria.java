package tech.cids.platform.permission;

/**
 * Filters for {@link PermissionRegistry#searchPermissions}. Null fields match everything.
 */
public record PermissionSearchCriteria(
    String appId,
    String resource,
    String action,
    String fieldContains,
    boolean sensitiveOnly
) {
    public static PermissionSearchCriteria forApp(String appId) {
        return new PermissionSearchCriteria(appId, null, null, null, false);
    }

    boolean matches(PermissionMetadata permission) {
        if (resource != null && !resource.equals(permission.resource())) {
            return false;
        }
        if (action != null && !action.equals(permission.action())) {
            return false;
        }
        if (fieldContains != null && !permission.fieldPath().contains(fieldContains)) {
            return false;
        }
        return !sensitiveOnly || permission.isClassified();
    }
}
