package tech.cids.platform.discovery.model;

/**
 * Data classification flags carried by a field.
 */
public record SensitivityFlags(boolean sensitive, boolean pii, boolean phi, boolean financial) {

    private static final SensitivityFlags NONE = new SensitivityFlags(false, false, false, false);

    public static SensitivityFlags none() {
        return NONE;
    }

    /**
     * True if any classification flag is set.
     */
    public boolean any() {
        return sensitive || pii || phi || financial;
    }
}
