package ai.romantext.harmony.harmony;

import ai.romantext.harmony.annotation.AnnotationEvent;
import ai.romantext.harmony.score.Position;
import java.util.List;
import java.util.Optional;

/**
 * Working state of one {@link HarmonyStateMachine#resolve} call.
 */
final class HarmonyState {

    private final List<AnnotationEvent> annotations;
    private KeyContext keyContext = KeyContext.unestablished();
    private Optional<String> tonicization = Optional.empty();
    private int cursor;

    HarmonyState(List<AnnotationEvent> annotations) {
        this.annotations = annotations;
    }

    KeyContext keyContext() {
        return keyContext;
    }

    Optional<String> tonicization() {
        return tonicization;
    }

    void clearTonicization() {
        tonicization = Optional.empty();
    }

    void tonicize(String token) {
        tonicization = Optional.of(token);
    }

    /**
     * Sets the key and clears any tonicization. Returns whether this differs from the prevailing key.
     */
    boolean establish(Key key) {
        boolean changed = !keyContext.key().map(key::equals).orElse(false);
        keyContext = KeyContext.of(key);
        tonicization = Optional.empty();
        return changed;
    }

    /**
     * Consumes the next pending annotation if it sits exactly at {@code position}. Otherwise the cursor holds.
     */
    Optional<AnnotationEvent> consumeAt(Position position) {
        if (cursor < annotations.size() && annotations.get(cursor).position().equals(position)) {
            return Optional.of(annotations.get(cursor++));
        }
        return Optional.empty();
    }

    /**
     * Annotations from the cursor onward, none of which was applied.
     */
    List<AnnotationEvent> unused() {
        return List.copyOf(annotations.subList(cursor, annotations.size()));
    }
}
