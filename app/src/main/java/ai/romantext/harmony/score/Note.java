package ai.romantext.harmony.score;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A note, chord or rest within one measure of a part. A rest carries no pitches.
 */
public record Note(Rational beat, Rational duration, List<Pitch> pitches, Optional<String> lyric) {

    public Note {
        Objects.requireNonNull(beat, "beat");
        Objects.requireNonNull(duration, "duration");
        pitches = pitches == null ? List.of() : List.copyOf(pitches);
        lyric = lyric == null ? Optional.empty() : lyric.filter(value -> !value.isEmpty());
    }

    public static Note rest(Rational beat, Rational duration) {
        return new Note(beat, duration, List.of(), Optional.empty());
    }

    public boolean isRest() {
        return pitches.isEmpty();
    }

    /**
     * Whether the note is still sounding at {@code beat} of the same measure.
     */
    public boolean soundsAt(Rational beat) {
        return this.beat.compareTo(beat) <= 0 && this.beat.plus(duration).compareTo(beat) > 0;
    }
}
