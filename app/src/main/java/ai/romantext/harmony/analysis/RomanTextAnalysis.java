package ai.romantext.harmony.analysis;

import ai.romantext.harmony.annotation.AnnotationEvent;
import ai.romantext.harmony.annotation.AnnotationEventReader;
import ai.romantext.harmony.annotation.ScoreAnnotationReader;
import ai.romantext.harmony.harmony.HarmonyStateMachine;
import ai.romantext.harmony.harmony.LabeledChord;
import ai.romantext.harmony.repeat.RepeatRange;
import ai.romantext.harmony.repeat.RepeatRangeDetector;
import ai.romantext.harmony.repeat.StructuralMeasure;
import ai.romantext.harmony.score.ChordEvent;
import ai.romantext.harmony.score.Chordifier;
import ai.romantext.harmony.score.Score;
import ai.romantext.harmony.writer.BeatFormatter;
import ai.romantext.harmony.writer.DocumentLine;
import ai.romantext.harmony.writer.LineSerializer;
import ai.romantext.harmony.writer.MeasureLines;
import ai.romantext.harmony.writer.Preamble;
import ai.romantext.harmony.writer.RomanTextDocument;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles one score into a RomanText document in template, full or partial mode.
 */
public class RomanTextAnalysis {

    private static final Logger LOGGER = LoggerFactory.getLogger(RomanTextAnalysis.class);

    private final Score score;
    private final AnalysisOptions options;
    private final LineSerializer lineSerializer;
    private final AnnotationEventReader annotationReader;
    private final Chordifier chordifier;
    private final HarmonyStateMachine harmonyStateMachine;
    private final RepeatRangeDetector repeatRangeDetector;

    public RomanTextAnalysis(Score score, AnalysisOptions options) {
        this(score, options,
                new ScoreAnnotationReader(score, options.analysisPart(), options.annotationTextClass(), options.adaptText()),
                new Chordifier(), new HarmonyStateMachine(), new RepeatRangeDetector());
    }

    public RomanTextAnalysis(Score score,
                             AnalysisOptions options,
                             AnnotationEventReader annotationReader,
                             Chordifier chordifier,
                             HarmonyStateMachine harmonyStateMachine,
                             RepeatRangeDetector repeatRangeDetector) {
        this.score = Objects.requireNonNull(score, "score");
        this.options = Objects.requireNonNull(options, "options");
        this.lineSerializer = new LineSerializer(score.firstMeasureNumber(), score.lastMeasureNumber());
        this.annotationReader = Objects.requireNonNull(annotationReader, "annotationReader");
        this.chordifier = Objects.requireNonNull(chordifier, "chordifier");
        this.harmonyStateMachine = Objects.requireNonNull(harmonyStateMachine, "harmonyStateMachine");
        this.repeatRangeDetector = Objects.requireNonNull(repeatRangeDetector, "repeatRangeDetector");
    }

    public RomanTextDocument compile(AnalysisMode mode) {
        Objects.requireNonNull(mode, "mode");
        Preamble preamble = Preamble.from(score.metadata(), options.metadata());
        SortedMap<Integer, RepeatRange> repeats = options.detectRepeats() ? repeats() : Collections.emptySortedMap();

        Optional<MeasureLines> content = switch (mode) {
            case TEMPLATE -> Optional.empty();
            case FULL -> Optional.of(fullAnalysisLines());
            case PARTIAL -> Optional.of(deducedAnalysisLines());
        };
        List<DocumentLine> body = lineSerializer.serialize(score.timeSignatureChanges(), repeats, content,
                mode == AnalysisMode.TEMPLATE);
        LOGGER.info("Compiled {} document: {} body lines, {} repeats", mode.name().toLowerCase(), body.size(), repeats.size());
        return new RomanTextDocument(preamble, body);
    }

    /**
     * Chord labels deduced from the reduction and its key and tonicization annotations.
     */
    public List<LabeledChord> deduce() {
        List<ChordEvent> chords = chordifier.chordify(score, options.ignoreParts());
        List<AnnotationEvent> annotations = annotationReader.read();
        LOGGER.info("Deducing labels for {} chords from {} annotations", chords.size(), annotations.size());
        return harmonyStateMachine.resolve(chords, annotations, options.tonicizationsPersist());
    }

    public SortedMap<Integer, RepeatRange> repeats() {
        return new TreeMap<>(repeatRangeDetector.detect(StructuralMeasure.of(score), options.templateParts(),
                options.repeatThreshold()));
    }

    private MeasureLines fullAnalysisLines() {
        List<AnnotationEvent> annotations = annotationReader.read();
        if (annotations.isEmpty()) {
            LOGGER.warn("No annotations found on the analysis part; the document will contain no analysis");
        }
        return MeasureLines.from(annotations, AnnotationEvent::position, AnnotationEvent::text, beatFormatter());
    }

    private MeasureLines deducedAnalysisLines() {
        return MeasureLines.from(deduce(), LabeledChord::position, LabeledChord::label, beatFormatter());
    }

    private BeatFormatter beatFormatter() {
        return new BeatFormatter(options.beatPrecision());
    }
}
