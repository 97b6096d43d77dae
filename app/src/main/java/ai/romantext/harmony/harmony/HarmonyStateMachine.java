package ai.romantext.harmony.harmony;

import ai.romantext.harmony.annotation.AnnotationEvent;
import ai.romantext.harmony.score.ChordEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Labels each chord of a reduction from sparse key and tonicization annotations.
 *
 * <p>An annotation applies to the chord at exactly its position. Text starting with {@code /} tonicizes
 * the prevailing key by the Roman numeral that follows; any other text names a new key, which also ends
 * any tonicization. Keys persist until the next key label. Tonicizations persist only when requested,
 * and otherwise apply to a single chord. Chords heard before any key label are read in C major.
 */
public class HarmonyStateMachine {

    private static final Logger LOGGER = LoggerFactory.getLogger(HarmonyStateMachine.class);
    static final Key DEFAULT_KEY = Key.parse("C");

    private final ScaleDegreeResolver degreeResolver;
    private final FigureDeriver figureDeriver;

    public HarmonyStateMachine() {
        this(new DiatonicDegreeResolver(), new TertianFigureDeriver());
    }

    public HarmonyStateMachine(ScaleDegreeResolver degreeResolver, FigureDeriver figureDeriver) {
        this.degreeResolver = Objects.requireNonNull(degreeResolver, "degreeResolver");
        this.figureDeriver = Objects.requireNonNull(figureDeriver, "figureDeriver");
    }

    public List<LabeledChord> resolve(List<ChordEvent> chords, List<AnnotationEvent> annotations, boolean tonicizationPersists) {
        Objects.requireNonNull(chords, "chords");
        HarmonyState state = new HarmonyState(annotations == null ? List.of() : List.copyOf(annotations));
        List<LabeledChord> labels = new ArrayList<>(chords.size());
        for (ChordEvent chord : chords) {
            labels.add(label(chord, state, tonicizationPersists));
        }

        List<AnnotationEvent> unused = state.unused();
        if (!unused.isEmpty()) {
            LOGGER.warn("{} annotations matched no chord position", unused.size());
            unused.forEach(event -> LOGGER.debug("Unused annotation '{}' at {}", event.text(), event.position()));
        }
        LOGGER.info("Labelled {} chords", labels.size());
        return List.copyOf(labels);
    }

    private LabeledChord label(ChordEvent chord, HarmonyState state, boolean tonicizationPersists) {
        if (!tonicizationPersists) {
            state.clearTonicization();
        }

        boolean keyChanged = false;
        Optional<AnnotationEvent> annotation = state.consumeAt(chord.position());
        if (annotation.isPresent()) {
            String text = annotation.get().text();
            if (annotation.get().isTonicization()) {
                state.tonicize(text.substring(1).strip());
            } else {
                Optional<Key> key = parseKey(text);
                if (key.isPresent()) {
                    keyChanged = state.establish(key.get());
                } else {
                    LOGGER.warn("Ignoring annotation '{}' at {}: neither a key label nor a tonicization", text, chord.position());
                }
            }
        }

        String figure = figureDeriver.derive(chord, effectiveKey(state, chord));
        if (keyChanged) {
            return new LabeledChord(chord.position(), state.keyContext().key().orElseThrow() + ": " + figure);
        }
        if (state.tonicization().isPresent()) {
            return new LabeledChord(chord.position(), figure + "/" + state.tonicization().get());
        }
        return new LabeledChord(chord.position(), figure);
    }

    private Key effectiveKey(HarmonyState state, ChordEvent chord) {
        Optional<String> tonicization = state.tonicization();
        if (tonicization.isEmpty()) {
            return state.keyContext().key().orElse(DEFAULT_KEY);
        }
        Key key = state.keyContext().key()
                .orElseThrow(() -> new InvalidTonicizationException("Tonicization /" + tonicization.get()
                        + " at " + chord.position() + " precedes any key label"));
        ResolvedDegree degree = degreeResolver.resolve(tonicization.get(), key);
        if (!degree.quality().isMajorOrMinor()) {
            throw new InvalidTonicizationException("Tonicization /" + tonicization.get() + " at " + chord.position()
                    + " resolves to a " + degree.quality().name().toLowerCase().replace('_', '-')
                    + " triad in " + key + "; only major and minor triads can act as local keys");
        }
        return new Key(degree.root(), degree.quality() == ChordQuality.MAJOR ? KeyMode.MAJOR : KeyMode.MINOR);
    }

    private static Optional<Key> parseKey(String text) {
        try {
            return Optional.of(Key.parse(text));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
