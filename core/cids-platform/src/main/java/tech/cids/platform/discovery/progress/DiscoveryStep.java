package tech.cids.platform.discovery.progress;

/**
 * Pipeline stage of a discovery run, with the completion percentage it represents.
 */
public enum DiscoveryStep {
    PENDING(0),
    HEALTH_CHECK(10),
    FETCHING(30),
    VALIDATING(50),
    GENERATING_PERMISSIONS(70),
    STORING(85),
    SUCCESS(100),
    FAILED(100);

    private final int percentage;

    DiscoveryStep(int percentage) {
        this.percentage = percentage;
    }

    public int percentage() {
        return percentage;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
