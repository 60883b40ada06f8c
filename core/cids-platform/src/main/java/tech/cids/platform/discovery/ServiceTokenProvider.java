package tech.cids.platform.discovery;

/**
 * Supplies the short-lived bearer token presented to applications during discovery.
 */
public interface ServiceTokenProvider {

    String discoveryToken();
}
