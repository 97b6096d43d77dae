package ai.romantext.harmony.annotation;

import ai.romantext.harmony.score.Position;
import java.util.Objects;

/**
 * Analyst text attached to a score position.
 */
public record AnnotationEvent(Position position, String text) {

    public AnnotationEvent {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(text, "text");
    }

    public boolean isTonicization() {
        return text.startsWith("/");
    }
}
