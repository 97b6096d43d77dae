package ai.romantext.harmony.harmony;

/**
 * Triad quality of a resolved degree or derived chord.
 */
public enum ChordQuality {
    MAJOR,
    MINOR,
    DIMINISHED,
    HALF_DIMINISHED,
    AUGMENTED;

    public boolean isMajorOrMinor() {
        return this == MAJOR || this == MINOR;
    }

    public boolean isUpperCase() {
        return this == MAJOR || this == AUGMENTED;
    }
}
