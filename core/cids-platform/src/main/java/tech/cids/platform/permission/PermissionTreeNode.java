package tech.cids.platform.permission;

import java.util.List;

/**
 * One {@code resource -> action} node of an application's permission tree.
 *
 * @param fields field-level permissions under this action, wildcard excluded
 * @param hasWildcard whether {@code app.resource.action.*} is in the catalog
 * @param sensitiveCount number of classified fields
 */
public record PermissionTreeNode(List<PermissionMetadata> fields, boolean hasWildcard, int sensitiveCount) {
}
