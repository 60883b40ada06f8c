package tech.cids.platform.discovery.model;

/**
 * HTTP methods a discovered endpoint may declare.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS;

    /**
     * Parse a method name, case-insensitively.
     *
     * @return the method, or null if it is not one of the supported methods
     */
    public static HttpMethod parse(String value) {
        if (value == null) {
            return null;
        }
        for (HttpMethod method : values()) {
            if (method.name().equalsIgnoreCase(value.trim())) {
                return method;
            }
        }
        return null;
    }

    /**
     * Whether requests with this method carry a body whose fields are permissioned as writes.
     */
    public boolean carriesRequestBody() {
        return this == POST || this == PUT || this == PATCH;
    }
}
