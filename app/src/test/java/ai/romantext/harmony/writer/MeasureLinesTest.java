package ai.romantext.harmony.writer;

import static org.assertj.core.api.Assertions.assertThat;

import ai.romantext.harmony.harmony.LabeledChord;
import ai.romantext.harmony.score.Position;
import ai.romantext.harmony.score.Rational;
import java.util.List;
import org.junit.jupiter.api.Test;

class MeasureLinesTest {

    @Test
    void opensOneLinePerMeasure() {
        MeasureLines lines = MeasureLines.from(List.of(new LabeledChord(Position.of(1, 1), "G: I")),
                LabeledChord::position, LabeledChord::label, new BeatFormatter());

        assertThat(lines.line(1)).contains("m1 b1 G: I");
        assertThat(lines.line(2)).isEmpty();
        assertThat(lines.size()).isEqualTo(1);
    }

    @Test
    void appendsBeatsWithinMeasure() {
        List<LabeledChord> chords = List.of(
                new LabeledChord(Position.of(15, 1), "V"),
                new LabeledChord(Position.of(15, 2), "iio"),
                new LabeledChord(Position.of(15, 3), "V7"),
                new LabeledChord(new Position(16, Rational.of(5, 2)), "I"));

        MeasureLines lines = MeasureLines.from(chords, LabeledChord::position, LabeledChord::label, new BeatFormatter());

        assertThat(lines.line(15)).contains("m15 b1 V b2 iio b3 V7");
        assertThat(lines.line(16)).contains("m16 b2.5 I");
    }
}
