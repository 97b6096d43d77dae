package ai.romantext.harmony.score;

import java.util.Comparator;
import java.util.Objects;

/**
 * Location of an event in the score, ordered by measure and then beat.
 */
public record Position(int measure, Rational beat) implements Comparable<Position> {

    private static final Comparator<Position> ORDER = Comparator.comparingInt(Position::measure)
            .thenComparing(Position::beat);

    public Position {
        if (measure < 0) {
            throw new IllegalArgumentException("measure must not be negative");
        }
        Objects.requireNonNull(beat, "beat");
        if (beat.compareTo(Rational.ONE) < 0) {
            throw new IllegalArgumentException("beat must be at least 1");
        }
    }

    public static Position of(int measure, long beat) {
        return new Position(measure, Rational.of(beat));
    }

    @Override
    public int compareTo(Position other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "m" + measure + " b" + beat;
    }
}
