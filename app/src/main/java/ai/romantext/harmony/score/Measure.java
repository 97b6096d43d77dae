package ai.romantext.harmony.score;

import java.util.Comparator;
import java.util.List;

/**
 * One measure of one part. Notes and expressions are kept in beat order.
 */
public record Measure(int number, List<Note> notes, List<TextExpression> expressions) {

    public Measure {
        if (number < 0) {
            throw new IllegalArgumentException("measure number must not be negative");
        }
        notes = notes == null ? List.of() : notes.stream()
                .sorted(Comparator.comparing(Note::beat))
                .toList();
        expressions = expressions == null ? List.of() : expressions.stream()
                .sorted(Comparator.comparing(TextExpression::beat))
                .toList();
    }
}
