package ai.romantext.harmony.score;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate pitch content sounding at one position, ordered from the bass upwards.
 */
public record ChordEvent(Position position, List<Pitch> pitches) {

    public ChordEvent {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(pitches, "pitches");
        if (pitches.isEmpty()) {
            throw new IllegalArgumentException("chord at " + position + " has no pitches");
        }
        pitches = pitches.stream().sorted(Comparator.comparingInt(Pitch::midi)).toList();
    }

    public Pitch bass() {
        return pitches.get(0);
    }
}
