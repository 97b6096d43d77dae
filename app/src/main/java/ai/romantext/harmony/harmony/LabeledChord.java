package ai.romantext.harmony.harmony;

import ai.romantext.harmony.score.Position;
import java.util.Objects;

/**
 * A chord position with its finished analysis label, e.g. {@code G: I} or {@code V7/ii}.
 */
public record LabeledChord(Position position, String label) {

    public LabeledChord {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(label, "label");
    }
}
