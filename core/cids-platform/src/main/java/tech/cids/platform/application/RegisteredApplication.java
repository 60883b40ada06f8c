package tech.cids.platform.application;

import java.time.Instant;

/**
 * A downstream application registered for discovery and token issuance.
 *
 * <p>{@code appId} is the stable business key that prefixes every permission key of the
 * application. {@code discoveryStatus} holds the outcome of the most recent discovery run.
 */
public class RegisteredApplication {

    public static final String STATUS_NEVER_RUN = "never_run";
    public static final String STATUS_SUCCESS = "success";

    public String id;

    public String appId;

    public String name;

    public String description;

    /**
     * URL of the application's capability document; discovery is skipped while blank.
     */
    public String discoveryUrl;

    public boolean allowDiscovery = false;

    public boolean active = true;

    public String discoveryStatus = STATUS_NEVER_RUN;

    public Instant lastDiscoveryAt;

    /**
     * Version string reported by the last successful discovery.
     */
    public String discoveryVersion;

    public int discoveryRunCount = 0;

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public RegisteredApplication() {
    }

    public RegisteredApplication(String id, String appId, String name, String discoveryUrl, boolean allowDiscovery) {
        this.id = id;
        this.appId = appId;
        this.name = name;
        this.discoveryUrl = discoveryUrl;
        this.allowDiscovery = allowDiscovery;
    }

    public boolean hasDiscoveryUrl() {
        return discoveryUrl != null && !discoveryUrl.isBlank();
    }
}
