package tech.cids.platform.permission;

/**
 * Thrown when a permission key cannot be parsed.
 */
public class MalformedPermissionKeyException extends IllegalArgumentException {

    private final String rawKey;

    public MalformedPermissionKeyException(String rawKey, String reason) {
        super("Malformed permission key '" + rawKey + "': " + reason);
        this.rawKey = rawKey;
    }

    public String getRawKey() {
        return rawKey;
    }
}
