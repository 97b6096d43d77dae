package ai.romantext.harmony.writer;

import ai.romantext.harmony.score.Rational;
import java.math.BigDecimal;

/**
 * Renders beats as integers where whole, otherwise as decimals rounded half-up to a fixed number of places.
 */
public class BeatFormatter {

    public static final int DEFAULT_PRECISION = 2;

    private final int precision;

    public BeatFormatter() {
        this(DEFAULT_PRECISION);
    }

    public BeatFormatter(int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("precision must not be negative");
        }
        this.precision = precision;
    }

    public String format(Rational beat) {
        if (beat.isWhole()) {
            return Long.toString(beat.numerator());
        }
        BigDecimal rounded = beat.toBigDecimal(precision).stripTrailingZeros();
        if (rounded.scale() < 0) {
            rounded = rounded.setScale(0);
        }
        return rounded.toPlainString();
    }
}
