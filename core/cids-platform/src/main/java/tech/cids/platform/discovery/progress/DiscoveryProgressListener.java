package tech.cids.platform.discovery.progress;

/**
 * Observer of discovery progress. Called off the discovery thread.
 */
@FunctionalInterface
public interface DiscoveryProgressListener {

    void onProgress(DiscoveryProgress progress);
}
