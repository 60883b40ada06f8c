package tech.cids.platform.permission;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Structured permission key {@code appId.resource.action.fieldPath}.
 *
 * <p>Recognized shapes, after {@code :} separators are rewritten to {@code .}:
 * <ul>
 *   <li>{@code *} - everything</li>
 *   <li>{@code app.*}, {@code app.resource.*}, {@code app.resource.action.*} - wildcards</li>
 *   <li>{@code app.resource.action.field.path} - a field; nested paths keep their dots,
 *       array elements appear as {@code items[]}</li>
 *   <li>{@code app.resource.<category>[.rest]} - a category key, see {@link PermissionCategory}</li>
 * </ul>
 *
 * <p>A wildcard may only appear as the last segment. Blank keys and empty segments are malformed.
 */
public record PermissionKey(
    String appId,
    String resource,
    String action,
    String fieldPath,
    PermissionCategory category
) {
    public static final String WILDCARD = "*";
    public static final String SEPARATOR = ".";
    private static final String WILDCARD_SUFFIX = ".*";

    /**
     * Build a field-level key.
     */
    public static PermissionKey of(String appId, String resource, String action, String fieldPath) {
        return new PermissionKey(appId, resource, action, fieldPath, null);
    }

    /**
     * Build the {@code app.resource.action.*} wildcard.
     */
    public static PermissionKey allFields(String appId, String resource, String action) {
        return new PermissionKey(appId, resource, action, WILDCARD, null);
    }

    /**
     * Canonical separator form: trims and rewrites {@code :} to {@code .}.
     */
    public static String normalize(String raw) {
        return raw == null ? null : raw.trim().replace(':', '.');
    }

    /**
     * Parse a raw key.
     *
     * @throws MalformedPermissionKeyException if the key is blank or structurally invalid
     */
    public static PermissionKey parse(String raw) {
        String key = normalize(raw);
        if (key == null || key.isEmpty()) {
            throw new MalformedPermissionKeyException(raw, "permission key is blank");
        }
        if (key.chars().anyMatch(Character::isWhitespace)) {
            throw new MalformedPermissionKeyException(raw, "permission key contains whitespace");
        }
        if (WILDCARD.equals(key)) {
            return new PermissionKey(WILDCARD, null, null, null, null);
        }

        String[] parts = key.split("\\.", -1);
        for (int i = 0; i < parts.length; i++) {
            if (parts[i].isEmpty()) {
                throw new MalformedPermissionKeyException(raw, "empty segment at position " + i);
            }
            if (parts[i].contains(WILDCARD) && (i != parts.length - 1 || !WILDCARD.equals(parts[i]))) {
                throw new MalformedPermissionKeyException(raw, "wildcard is only allowed as the last segment");
            }
        }
        if (parts.length < 2) {
            throw new MalformedPermissionKeyException(raw, "expected at least app.resource");
        }

        String appId = parts[0];
        String resource = parts[1];
        if (parts.length == 2) {
            return new PermissionKey(appId, resource, null, null, null);
        }

        PermissionCategory category = PermissionCategory.fromSegment(parts[2]);
        if (category != null) {
            String rest = parts.length > 3 ? String.join(SEPARATOR, List.of(parts).subList(3, parts.length)) : null;
            return new PermissionKey(appId, resource, null, rest, category);
        }

        String action = parts[2];
        String fieldPath = parts.length > 3 ? String.join(SEPARATOR, List.of(parts).subList(3, parts.length)) : null;
        return new PermissionKey(appId, resource, action, fieldPath, null);
    }

    /**
     * Parse without throwing.
     */
    public static Optional<PermissionKey> tryParse(String raw) {
        try {
            return Optional.of(parse(raw));
        } catch (MalformedPermissionKeyException e) {
            return Optional.empty();
        }
    }

    /**
     * Every wildcard that would cover {@code key}, most specific first.
     * For {@code a.b.c} that is {@code a.b.c.*}, {@code a.b.*}, {@code a.*}, {@code *}.
     */
    public static List<String> ancestorWildcards(String key) {
        String normalized = normalize(key);
        List<String> wildcards = new ArrayList<>();
        if (normalized == null || normalized.isEmpty() || WILDCARD.equals(normalized)) {
            wildcards.add(WILDCARD);
            return wildcards;
        }
        String base = normalized.endsWith(WILDCARD_SUFFIX)
            ? normalized.substring(0, normalized.length() - WILDCARD_SUFFIX.length())
            : normalized;
        String[] parts = base.split("\\.");
        for (int i = parts.length; i >= 1; i--) {
            String candidate = String.join(SEPARATOR, List.of(parts).subList(0, i)) + WILDCARD_SUFFIX;
            if (!candidate.equals(normalized)) {
                wildcards.add(candidate);
            }
        }
        wildcards.add(WILDCARD);
        return wildcards;
    }

    /**
     * Whether the textual wildcard {@code wildcard} covers {@code key}. Non-wildcards cover only themselves.
     */
    public static boolean covers(String wildcard, String key) {
        String w = normalize(wildcard);
        String k = normalize(key);
        if (w == null || k == null) {
            return false;
        }
        if (WILDCARD.equals(w)) {
            return true;
        }
        if (!w.endsWith(WILDCARD_SUFFIX)) {
            return w.equals(k);
        }
        String prefix = w.substring(0, w.length() - WILDCARD_SUFFIX.length());
        return k.equals(prefix) || k.startsWith(prefix + SEPARATOR);
    }

    public boolean isWildcard() {
        return WILDCARD.equals(appId) || WILDCARD.equals(resource)
            || WILDCARD.equals(action) || WILDCARD.equals(fieldPath);
    }

    public boolean isCategory() {
        return category != null;
    }

    /**
     * For a wildcard, the text it matches under ({@code app.resource} for {@code app.resource.*});
     * the empty string for {@code *}.
     */
    public String wildcardPrefix() {
        if (!isWildcard()) {
            throw new IllegalStateException("Not a wildcard: " + value());
        }
        String text = value();
        return WILDCARD.equals(text) ? "" : text.substring(0, text.length() - WILDCARD_SUFFIX.length());
    }

    /**
     * Canonical textual form.
     */
    public String value() {
        if (WILDCARD.equals(appId)) {
            return WILDCARD;
        }
        StringBuilder sb = new StringBuilder(appId);
        append(sb, resource);
        append(sb, category != null ? category.getValue() : action);
        append(sb, fieldPath);
        return sb.toString();
    }

    private static void append(StringBuilder sb, String segment) {
        if (segment != null) {
            sb.append(SEPARATOR).append(segment);
        }
    }

    @Override
    public String toString() {
        return value();
    }
}
