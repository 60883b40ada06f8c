package tech.cids.platform.discovery;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration for application discovery.
 */
@ConfigMapping(prefix = "cids.discovery")
public interface DiscoveryConfig {

    /**
     * How long a successful discovery result is served from cache.
     */
    @WithDefault("60m")
    Duration cacheTtl();

    @WithDefault("10s")
    Duration connectTimeout();

    @WithDefault("30s")
    Duration fetchTimeout();

    @WithDefault("5s")
    Duration healthCheckTimeout();

    /**
     * Upper bound for one discovery task, retries included.
     */
    @WithDefault("3m")
    Duration taskTimeout();

    /**
     * Run the HEAD reachability check before fetching.
     */
    @WithDefault("true")
    boolean healthCheckEnabled();

    /**
     * Attempts kept per application in the discovery history.
     */
    @WithDefault("100")
    int historySize();

    /**
     * Worker threads for discovery tasks.
     */
    @WithDefault("8")
    int workerThreads();

    Retry retry();

    interface Retry {
        /**
         * Retries after the first attempt; at most {@code maxRetries + 1} attempts are made.
         */
        @WithDefault("3")
        int maxRetries();

        @WithDefault("1s")
        Duration baseDelay();

        @WithDefault("2.0")
        double factor();

        @WithDefault("30s")
        Duration maxDelay();

        /**
         * Upper bound of the random jitter as a fraction of the computed delay.
         */
        @WithDefault("0.1")
        double jitterRatio();
    }
}
