package tech.cids.platform.permission;

import com.fasterxml.jackson.annotation.JsonValue;
import tech.cids.platform.discovery.model.SensitivityFlags;

/**
 * Closed set of permission categories.
 *
 * <p>A category names a class of fields within a resource, e.g. {@code hr.employees.pii}
 * grants the PII-classified fields of {@code employees}. Categories are synthesized from the
 * sensitivity flags discovered on fields and are never stored as literal catalog rows.
 */
public enum PermissionCategory {
    BASE("base"),
    PII("pii"),
    PHI("phi"),
    FINANCIAL("financial"),
    SENSITIVE("sensitive"),
    WILDCARD("wildcard");

    private final String value;

    PermissionCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Match a key segment against the category names.
     *
     * @return the category, or null if the segment is not a category name
     */
    public static PermissionCategory fromSegment(String segment) {
        for (PermissionCategory category : values()) {
            if (category.value.equals(segment)) {
                return category;
            }
        }
        return null;
    }

    /**
     * The most restrictive category implied by a field's flags. PHI outranks PII, which
     * outranks financial, which outranks the generic sensitive flag.
     */
    public static PermissionCategory of(SensitivityFlags flags) {
        if (flags.phi()) {
            return PHI;
        }
        if (flags.pii()) {
            return PII;
        }
        if (flags.financial()) {
            return FINANCIAL;
        }
        if (flags.sensitive()) {
            return SENSITIVE;
        }
        return BASE;
    }
}
