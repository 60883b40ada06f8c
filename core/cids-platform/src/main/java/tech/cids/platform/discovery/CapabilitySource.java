package tech.cids.platform.discovery;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Transport for capability documents.
 */
public interface CapabilitySource {

    /**
     * Cheap reachability check. Returns normally when the endpoint answered with anything below 500.
     *
     * @throws DiscoveryException with {@link DiscoveryErrorType#NETWORK_ERROR} when unreachable or failing
     */
    void checkHealth(String discoveryUrl) throws DiscoveryException;

    /**
     * Fetch the raw capability document.
     *
     * @param versioned request the current document version; false for the legacy format
     */
    JsonNode fetch(String discoveryUrl, boolean versioned) throws DiscoveryException;
}
