package tech.cids.platform.permission;

import tech.cids.platform.discovery.model.SensitivityFlags;

import java.time.Instant;

/**
 * One entry in an application's permission catalog.
 *
 * <p>Created by {@link PermissionExpander} and owned by {@link PermissionRegistry}.
 * Replaced wholesale by the next discovery run, never edited in place.
 */
public record PermissionMetadata(
    String permissionKey,
    String resource,
    String action,
    String fieldPath,
    String description,
    boolean sensitive,
    boolean pii,
    boolean phi,
    boolean financial,
    String sourceEndpointId,
    String discoveryRunId,
    Instant discoveredAt
) {

    public SensitivityFlags flags() {
        return new SensitivityFlags(sensitive, pii, phi, financial);
    }

    public PermissionCategory category() {
        return isWildcard() ? PermissionCategory.WILDCARD : PermissionCategory.of(flags());
    }

    public boolean isWildcard() {
        return PermissionKey.WILDCARD.equals(fieldPath);
    }

    /**
     * True for any classified field (sensitive, PII, PHI or financial).
     */
    public boolean isClassified() {
        return sensitive || pii || phi || financial;
    }
}
