package ai.romantext.harmony.annotation;

import static ai.romantext.harmony.score.ScoreFixtures.chord;
import static ai.romantext.harmony.score.ScoreFixtures.lyricChord;
import static ai.romantext.harmony.score.ScoreFixtures.measure;
import static ai.romantext.harmony.score.ScoreFixtures.part;
import static ai.romantext.harmony.score.ScoreFixtures.score;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.romantext.harmony.score.Measure;
import ai.romantext.harmony.score.Part;
import ai.romantext.harmony.score.Position;
import ai.romantext.harmony.score.Rational;
import ai.romantext.harmony.score.Score;
import ai.romantext.harmony.score.ScoreMetadata;
import ai.romantext.harmony.score.TextExpression;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScoreAnnotationReaderTest {

    private static final Score LYRIC_SCORE = score(List.of(),
            part("Voice", measure(1, lyricChord("1", "4", "la", "C5"))),
            part("Analysis",
                    measure(1, lyricChord("3", "1", "V7", "G3"), lyricChord("1", "2", "g:i", "G3")),
                    measure(2, lyricChord("1", "1", "?!", "C3"), chord("2", "1", "D3"),
                            lyricChord("3", "1", "ii°6", "F3"))));

    @Test
    void readsCanonicalizedLyricsOfLowestPartInPositionOrder() {
        List<AnnotationEvent> events = new ScoreAnnotationReader(LYRIC_SCORE, -1, AnnotationTextClass.LYRIC, true).read();

        assertThat(events).containsExactly(
                new AnnotationEvent(Position.of(1, 1), "g: i"),
                new AnnotationEvent(Position.of(1, 3), "V7"),
                new AnnotationEvent(Position.of(2, 3), "iio6"));
    }

    @Test
    void keepsRawTextWhenAdaptationDisabled() {
        List<AnnotationEvent> events = new ScoreAnnotationReader(LYRIC_SCORE, 1, AnnotationTextClass.LYRIC, false).read();

        assertThat(events).extracting(AnnotationEvent::text).containsExactly("g:i", "V7", "?!", "ii°6");
    }

    @Test
    void readsTextExpressionsAndKeepsFirstOfDuplicatePositions() {
        Measure measure = new Measure(1, List.of(), List.of(
                new TextExpression(Rational.of(1), "C:"),
                new TextExpression(Rational.of(1), "G:"),
                new TextExpression(Rational.of(5, 2), "/V")));
        Score score = new Score(ScoreMetadata.empty(), List.of(), List.of(new Part("Reduction", List.of(measure))));

        List<AnnotationEvent> events = new ScoreAnnotationReader(score, 0, AnnotationTextClass.TEXT_EXPRESSION, true).read();

        assertThat(events).containsExactly(
                new AnnotationEvent(Position.of(1, 1), "C: "),
                new AnnotationEvent(new Position(1, Rational.of(5, 2)), "/V"));
        assertThat(events.get(1).isTonicization()).isTrue();
        assertThat(events.get(0).isTonicization()).isFalse();
    }

    @Test
    void rejectsPartOutsideScore() {
        assertThatThrownBy(() -> new ScoreAnnotationReader(LYRIC_SCORE, 2, AnnotationTextClass.LYRIC, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> new ScoreAnnotationReader(LYRIC_SCORE, -3, AnnotationTextClass.LYRIC, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parsesTextClassNames() {
        assertThat(AnnotationTextClass.from("text-expression")).isEqualTo(AnnotationTextClass.TEXT_EXPRESSION);
        assertThat(AnnotationTextClass.from("Lyric")).isEqualTo(AnnotationTextClass.LYRIC);
        assertThatThrownBy(() -> AnnotationTextClass.from("chord-symbol")).isInstanceOf(IllegalArgumentException.class);
    }
}
