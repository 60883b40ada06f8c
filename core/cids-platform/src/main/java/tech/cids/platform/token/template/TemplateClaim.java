package tech.cids.platform.token.template;

/**
 * One claim a token template lets through.
 *
 * @param include false lists the claim without letting it through
 * @param value fallback when the composed claims lack the key
 * @param type {@code array} or {@code object} fall back to an empty value when no {@code value} is set
 */
public record TemplateClaim(String key, boolean include, Object value, String type) {

    public static TemplateClaim of(String key) {
        return new TemplateClaim(key, true, null, null);
    }
}
