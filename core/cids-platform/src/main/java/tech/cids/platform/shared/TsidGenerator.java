package tech.cids.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation for all entities.
 *
 * IDs are time-sortable 64-bit values rendered as 13 Crockford base32 characters,
 * prefixed with the entity type where the type asks for it
 * (e.g., "rol_0HZXEQ5Y8JY5Z").
 */
public class TsidGenerator {

    /**
     * Separator between prefix and TSID.
     */
    public static final String SEPARATOR = "_";

    /**
     * Generate a new ID for the given entity type.
     *
     * @param type the entity type
     * @return the ID (with or without prefix depending on entity type)
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        String tsid = TsidCreator.getTsid().toString();
        return type.usePrefix() ? type.prefix() + SEPARATOR + tsid : tsid;
    }

    /**
     * Generate a raw TSID without prefix, for non-entity IDs such as discovery run IDs
     * carried inside permission metadata.
     */
    public static String generateRaw() {
        return TsidCreator.getTsid().toString();
    }

    /**
     * Extract the prefix from a typed ID.
     *
     * @throws IllegalArgumentException if the ID format is invalid
     */
    public static String extractPrefix(String typedId) {
        if (typedId == null || typedId.isBlank()) {
            throw new IllegalArgumentException("Typed ID cannot be null or blank");
        }
        int separatorIndex = typedId.indexOf(SEPARATOR);
        if (separatorIndex == -1) {
            throw new IllegalArgumentException("Invalid typed ID format: missing separator");
        }
        return typedId.substring(0, separatorIndex);
    }

    private TsidGenerator() {
        // Utility class
    }
}
