package ai.romantext.harmony.score;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Small builders for hand-made scores used across the test suite.
 */
public final class ScoreFixtures {

    private ScoreFixtures() {
    }

    public static Note chord(String beat, String duration, String... pitches) {
        return new Note(Rational.parse(beat), Rational.parse(duration),
                Arrays.stream(pitches).map(Pitch::parse).toList(), Optional.empty());
    }

    public static Note lyricChord(String beat, String duration, String lyric, String... pitches) {
        return new Note(Rational.parse(beat), Rational.parse(duration),
                Arrays.stream(pitches).map(Pitch::parse).toList(), Optional.of(lyric));
    }

    public static Note rest(String beat, String duration) {
        return Note.rest(Rational.parse(beat), Rational.parse(duration));
    }

    public static Measure measure(int number, Note... notes) {
        return new Measure(number, List.of(notes), List.of());
    }

    public static Part part(String name, Measure... measures) {
        return new Part(name, List.of(measures));
    }

    public static Score score(List<TimeSignature> timeSignatures, Part... parts) {
        return new Score(ScoreMetadata.empty(), timeSignatures, List.of(parts));
    }
}
