package ai.romantext.harmony.score;

import java.util.Objects;

/**
 * Free text attached to a beat of a measure.
 */
public record TextExpression(Rational beat, String text) {

    public TextExpression {
        Objects.requireNonNull(beat, "beat");
        text = text == null ? "" : text;
    }
}
