package ai.romantext.harmony.analysis;

import static ai.romantext.harmony.score.ScoreFixtures.chord;
import static ai.romantext.harmony.score.ScoreFixtures.lyricChord;
import static ai.romantext.harmony.score.ScoreFixtures.measure;
import static ai.romantext.harmony.score.ScoreFixtures.part;
import static ai.romantext.harmony.score.ScoreFixtures.rest;
import static ai.romantext.harmony.score.ScoreFixtures.score;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.romantext.harmony.annotation.AnnotationEvent;
import ai.romantext.harmony.annotation.AnnotationTextClass;
import ai.romantext.harmony.harmony.HarmonyStateMachine;
import ai.romantext.harmony.harmony.InvalidTonicizationException;
import ai.romantext.harmony.harmony.LabeledChord;
import ai.romantext.harmony.repeat.PartSelector;
import ai.romantext.harmony.repeat.RepeatRangeDetector;
import ai.romantext.harmony.score.Chordifier;
import ai.romantext.harmony.score.Measure;
import ai.romantext.harmony.score.Position;
import ai.romantext.harmony.score.Score;
import ai.romantext.harmony.score.TimeSignature;
import ai.romantext.harmony.writer.AnalysisMetadata;
import ai.romantext.harmony.writer.InvalidFirstMeasureException;
import ai.romantext.harmony.writer.RomanTextDocument;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RomanTextAnalysisTest {

    private static final List<TimeSignature> COMMON_TIME = List.of(new TimeSignature(1, "4/4"));

    @Test
    void templateListsEveryMeasureAndRepeats() {
        Score score = score(COMMON_TIME,
                part("Melody",
                        measure(1, chord("1", "4", "E5")),
                        measure(2, chord("1", "4", "D5")),
                        measure(3, chord("1", "4", "E5")),
                        measure(4, chord("1", "4", "D5"))),
                part("Bass",
                        measure(1, chord("1", "4", "C3")),
                        measure(2, chord("1", "4", "G2")),
                        measure(3, chord("1", "4", "C3")),
                        measure(4, chord("1", "4", "G2"))));

        RomanTextDocument document = new RomanTextAnalysis(score, AnalysisOptions.defaults()).compile(AnalysisMode.TEMPLATE);

        assertThat(document.lines()).containsExactly(
                "Composer: ", "Title: ", "Analyst: Unknown", "Proofreader: Unknown", "", "",
                "\nTime Signature: 4/4", "m1 b1", "m2 b1", "m3-4 = m1-2", "m3 b1", "m4 b1");
        assertThat(document.preamble().fileStem()).isEqualTo("Unknown_-_Unknown");
    }

    @Test
    void templateOfLongCompoundMeterScoreListsEveryMeasure() {
        String[] bass = {"C3", "D3", "E3", "F3", "G3", "A3", "B3", "C4", "D4", "E4", "F4", "G4", "A4", "B4"};
        Measure[] measures = new Measure[bass.length];
        for (int i = 0; i < bass.length; i++) {
            measures[i] = measure(i + 1, chord("1", "6", bass[i]));
        }
        Score score = score(List.of(new TimeSignature(1, "12/8")), part("Solo", measures));

        RomanTextDocument document = new RomanTextAnalysis(score, AnalysisOptions.defaults()).compile(AnalysisMode.TEMPLATE);

        List<String> body = document.lines().subList(document.preamble().lines().size(), document.lines().size());
        assertThat(body).hasSize(15);
        assertThat(body.get(0)).isEqualTo("\nTime Signature: 12/8");
        assertThat(body).contains("m14 b1").endsWith("m14 b1");
        assertThat(body).noneMatch(line -> line.contains(" = "));
    }

    @Test
    void repeatShorthandCanBeSwitchedOff() {
        Score score = score(COMMON_TIME,
                part("Solo", measure(1, chord("1", "4", "C4")), measure(2, chord("1", "4", "C4"))));
        AnalysisOptions options = new AnalysisOptions(-1, AnnotationTextClass.LYRIC, true, PartSelector.all(), false,
                1, 2, false, 2, AnalysisMetadata.empty());

        RomanTextDocument document = new RomanTextAnalysis(score, options).compile(AnalysisMode.TEMPLATE);

        assertThat(document.lines()).doesNotContain("m2 = m1").contains("m2 b1");
    }

    @Test
    void fullAnalysisCopiesAnnotationsFromLowestPart() {
        Score score = score(COMMON_TIME,
                part("Piano", measure(1, chord("1", "4", "G3", "B3", "D4"))),
                part("Analysis", measure(1,
                        lyricChord("1", "1", "G: I", "G3"),
                        lyricChord("2", "1", "ii°", "A3"),
                        lyricChord("3", "2", "V7", "D3"))));

        RomanTextDocument document = new RomanTextAnalysis(score, AnalysisOptions.defaults()).compile(AnalysisMode.FULL);

        assertThat(document.lines()).endsWith("\nTime Signature: 4/4", "m1 b1 G: I b2 iio b3 V7");
    }

    @Test
    void partialAnalysisDeducesChordsFromReduction() {
        Score score = partialScore("/V");

        RomanTextDocument document = new RomanTextAnalysis(score, AnalysisOptions.defaults()).compile(AnalysisMode.PARTIAL);

        assertThat(document.lines()).endsWith("\nTime Signature: 4/4", "m1 b1 C: I b3 V7/V", "m2 b1 V");
    }

    @Test
    void deduceReturnsLabelsByPosition() {
        List<LabeledChord> labels = new RomanTextAnalysis(partialScore("/V"), AnalysisOptions.defaults()).deduce();

        assertThat(labels).extracting(LabeledChord::position)
                .containsExactly(Position.of(1, 1), Position.of(1, 3), Position.of(2, 1));
    }

    @Test
    void partialAnalysisStopsOnUnusableTonicization() {
        RomanTextAnalysis analysis = new RomanTextAnalysis(partialScore("/viio"), AnalysisOptions.defaults());

        assertThatThrownBy(() -> analysis.compile(AnalysisMode.PARTIAL))
                .isInstanceOf(InvalidTonicizationException.class);
    }

    @Test
    void usesInjectedAnnotationReader() {
        Score score = partialScore("/V");
        List<AnnotationEvent> annotations = List.of(new AnnotationEvent(Position.of(1, 1), "F"));

        RomanTextAnalysis analysis = new RomanTextAnalysis(score, AnalysisOptions.defaults(), () -> annotations,
                new Chordifier(), new HarmonyStateMachine(), new RepeatRangeDetector());

        assertThat(analysis.deduce()).extracting(LabeledChord::label).containsExactly("F: V", "VI7", "II");
    }

    @Test
    void rejectsScoresStartingAfterMeasureOne() {
        Score score = score(List.of(), part("Solo", measure(3, chord("1", "4", "C4"))));

        assertThatThrownBy(() -> new RomanTextAnalysis(score, AnalysisOptions.defaults()))
                .isInstanceOf(InvalidFirstMeasureException.class)
                .hasMessageContaining("currently 3");
    }

    @Test
    void analystMetadataNamesTheFile() {
        Score score = score(COMMON_TIME, part("Solo", measure(1, chord("1", "4", "C4"))));
        AnalysisMetadata metadata = new AnalysisMetadata(Optional.of("Schubert"), Optional.of("Ständchen"),
                Optional.empty(), Optional.empty(), List.of());
        AnalysisOptions options = new AnalysisOptions(-1, AnnotationTextClass.LYRIC, true, PartSelector.all(), true,
                1, 2, false, 2, metadata);

        RomanTextDocument document = new RomanTextAnalysis(score, options).compile(AnalysisMode.TEMPLATE);

        assertThat(document.preamble().fileStem()).isEqualTo("Schubert_-_Ständchen");
        assertThat(document.lines()).startsWith("Composer: Schubert", "Title: Ständchen");
    }

    @Test
    void parsesModeNames() {
        assertThat(AnalysisMode.from("partial")).isEqualTo(AnalysisMode.PARTIAL);
        assertThat(AnalysisMode.from(null)).isEqualTo(AnalysisMode.TEMPLATE);
        assertThatThrownBy(() -> AnalysisMode.from("sketch")).isInstanceOf(IllegalArgumentException.class);
    }

    private static Score partialScore(String tonicization) {
        return score(COMMON_TIME,
                part("Voice", measure(1, rest("1", "4")), measure(2, rest("1", "4"))),
                part("Piano", measure(1, rest("1", "4")), measure(2, rest("1", "4"))),
                part("Reduction",
                        measure(1,
                                lyricChord("1", "2", "C:", "C3", "E3", "G3"),
                                lyricChord("3", "2", tonicization, "D3", "F#3", "A3", "C4")),
                        measure(2, chord("1", "4", "G2", "B2", "D3"))));
    }
}
