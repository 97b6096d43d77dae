package ai.romantext.harmony.score;

import static ai.romantext.harmony.score.ScoreFixtures.chord;
import static ai.romantext.harmony.score.ScoreFixtures.measure;
import static ai.romantext.harmony.score.ScoreFixtures.part;
import static ai.romantext.harmony.score.ScoreFixtures.rest;
import static ai.romantext.harmony.score.ScoreFixtures.score;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ChordifierTest {

    @Test
    void collectsEverythingSoundingAtEachOnset() {
        Score score = score(List.of(),
                part("Melody", measure(1, chord("1", "4", "C6"))),
                part("Upper", measure(1, chord("1", "2", "E4"), chord("3", "2", "F4"))),
                part("Bass", measure(1, chord("1", "4", "C3"))));

        List<ChordEvent> chords = new Chordifier().chordify(score, 1);

        assertThat(chords).extracting(ChordEvent::position)
                .containsExactly(Position.of(1, 1), Position.of(1, 3));
        assertThat(chords.get(0).pitches()).containsExactly(Pitch.parse("C3"), Pitch.parse("E4"));
        assertThat(chords.get(1).pitches()).containsExactly(Pitch.parse("C3"), Pitch.parse("F4"));
        assertThat(chords.get(1).bass()).isEqualTo(Pitch.parse("C3"));
    }

    @Test
    void skipsRestsAndMergesDoubledPitches() {
        Score score = score(List.of(),
                part("Upper", measure(1, rest("1", "1"), chord("2", "1", "G4", "B4"))),
                part("Lower", measure(1, rest("1", "1"), chord("2", "1", "G4", "D4"))));

        List<ChordEvent> chords = new Chordifier().chordify(score, 0);

        assertThat(chords).hasSize(1);
        assertThat(chords.get(0).position()).isEqualTo(Position.of(1, 2));
        assertThat(chords.get(0).pitches()).containsExactly(Pitch.parse("D4"), Pitch.parse("G4"), Pitch.parse("B4"));
    }

    @Test
    void rejectsIgnoringEveryPart() {
        Score score = score(List.of(), part("Only", measure(1, chord("1", "1", "C4"))));

        assertThatThrownBy(() -> new Chordifier().chordify(score, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ignoreParts");
    }
}
