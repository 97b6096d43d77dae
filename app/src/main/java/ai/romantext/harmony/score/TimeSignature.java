package ai.romantext.harmony.score;

import java.util.Objects;

/**
 * A time signature taking effect at the start of a measure, e.g. {@code 12/8}.
 */
public record TimeSignature(int measure, String ratio) {

    public TimeSignature {
        if (measure < 0) {
            throw new IllegalArgumentException("measure must not be negative");
        }
        Objects.requireNonNull(ratio, "ratio");
        if (!ratio.matches("\\d+/\\d+")) {
            throw new IllegalArgumentException("Invalid time signature ratio: " + ratio);
        }
    }
}
