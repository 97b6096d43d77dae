package ai.romantext.harmony.analysis;

/**
 * What kind of document to produce.
 */
public enum AnalysisMode {
    /** Empty measure skeleton, no analysis. */
    TEMPLATE,
    /** Complete analysis already written on the score. */
    FULL,
    /** Key and tonicization labels on a reduction; chord labels are deduced. */
    PARTIAL;

    public static AnalysisMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TEMPLATE;
        }
        for (AnalysisMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported analysis mode: " + raw + " (expected template, full or partial)");
    }
}
