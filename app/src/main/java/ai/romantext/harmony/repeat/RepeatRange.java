package ai.romantext.harmony.repeat;

/**
 * A later passage (target) that repeats an earlier one (source) measure for measure.
 */
public record RepeatRange(int targetStart, int targetEnd, int sourceStart, int sourceEnd) {

    public RepeatRange {
        if (targetEnd < targetStart || sourceEnd < sourceStart) {
            throw new IllegalArgumentException("range ends must not precede their starts");
        }
        if (targetEnd - targetStart != sourceEnd - sourceStart) {
            throw new IllegalArgumentException("target and source must span the same number of measures");
        }
        if (targetStart <= sourceStart) {
            throw new IllegalArgumentException("target must start after its source");
        }
    }

    public boolean isSingleMeasure() {
        return targetStart == targetEnd;
    }

    boolean overlapsTarget(RepeatRange other) {
        return targetStart <= other.targetEnd && other.targetStart <= targetEnd;
    }
}
