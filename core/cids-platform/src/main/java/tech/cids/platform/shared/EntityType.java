package tech.cids.platform.shared;

import java.util.HashMap;
import java.util.Map;

/**
 * Defines all entity types in the system with their 3-character ID prefixes.
 *
 * IDs are stored WITH the prefix in the database:
 * - Format: "{prefix}_{tsid}" (e.g., "rol_0HZXEQ5Y8JY5Z")
 * - Total length: 17 characters (3-char prefix + underscore + 13-char TSID)
 *
 * Usage:
 * <pre>
 * String id = TsidGenerator.generate(EntityType.ROLE);  // "rol_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    // Applications and discovery
    APPLICATION("app"),
    DISCOVERED_ENDPOINT("ept"),
    DISCOVERY_ATTEMPT("dat", false),   // High-volume: no prefix
    DISCOVERY_RUN("drn"),

    // Authorization
    ROLE("rol"),
    GROUP_ROLE_MAPPING("grm"),
    POLICY_DOCUMENT("pol"),

    // Tokens
    TOKEN_TEMPLATE("ttp"),
    TOKEN_FAMILY("tfm"),
    ACCESS_TOKEN("atk", false);        // jti values: no prefix

    private final String prefix;
    private final boolean usePrefix;

    private static final Map<String, EntityType> BY_PREFIX = new HashMap<>();

    static {
        for (EntityType type : values()) {
            BY_PREFIX.put(type.prefix, type);
        }
    }

    EntityType(String prefix) {
        this(prefix, true);
    }

    EntityType(String prefix, boolean usePrefix) {
        this.prefix = prefix;
        this.usePrefix = usePrefix;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Whether IDs of this type carry the typed prefix.
     */
    public boolean usePrefix() {
        return usePrefix;
    }

    /**
     * Look up an entity type by its prefix.
     *
     * @return the entity type, or null if the prefix is unknown
     */
    public static EntityType fromPrefix(String prefix) {
        return BY_PREFIX.get(prefix);
    }
}
