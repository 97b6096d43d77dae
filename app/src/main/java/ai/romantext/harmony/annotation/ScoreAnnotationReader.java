package ai.romantext.harmony.annotation;

import ai.romantext.harmony.score.Measure;
import ai.romantext.harmony.score.Note;
import ai.romantext.harmony.score.Part;
import ai.romantext.harmony.score.Position;
import ai.romantext.harmony.score.Rational;
import ai.romantext.harmony.score.Score;
import ai.romantext.harmony.score.TextExpression;
import ai.romantext.harmony.text.TextCanonicalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads annotations from the lyrics or text expressions of one part of a score.
 */
public class ScoreAnnotationReader implements AnnotationEventReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScoreAnnotationReader.class);

    private final Score score;
    private final int partIndex;
    private final AnnotationTextClass textClass;
    private final boolean adaptText;

    /**
     * @param partIndex part holding the annotations; negative values count from the bottom, -1 being the lowest part
     * @param adaptText whether to pass every text through {@link TextCanonicalizer}
     */
    public ScoreAnnotationReader(Score score, int partIndex, AnnotationTextClass textClass, boolean adaptText) {
        this.score = Objects.requireNonNull(score, "score");
        this.textClass = Objects.requireNonNull(textClass, "textClass");
        int resolved = partIndex < 0 ? score.partCount() + partIndex : partIndex;
        if (resolved < 0 || resolved >= score.partCount()) {
            throw new IllegalArgumentException("analysis part " + partIndex + " is out of range for a score of "
                    + score.partCount() + " parts");
        }
        this.partIndex = resolved;
        this.adaptText = adaptText;
    }

    @Override
    public List<AnnotationEvent> read() {
        Part part = score.parts().get(partIndex);
        List<AnnotationEvent> collected = new ArrayList<>();
        for (Measure measure : part.measures()) {
            switch (textClass) {
                case LYRIC -> collectLyrics(measure, collected);
                case TEXT_EXPRESSION -> collectExpressions(measure, collected);
            }
        }
        collected.sort(Comparator.comparing(AnnotationEvent::position));

        List<AnnotationEvent> events = new ArrayList<>(collected.size());
        for (AnnotationEvent event : collected) {
            if (event.text().isBlank()) {
                LOGGER.debug("Skipping annotation at {} with no usable characters", event.position());
                continue;
            }
            if (!events.isEmpty() && events.get(events.size() - 1).position().equals(event.position())) {
                LOGGER.warn("Ignoring second annotation '{}' at {}", event.text(), event.position());
                continue;
            }
            events.add(event);
        }
        LOGGER.debug("Read {} annotations from part {} ({})", events.size(), partIndex, textClass);
        return List.copyOf(events);
    }

    private void collectLyrics(Measure measure, List<AnnotationEvent> target) {
        for (Note note : measure.notes()) {
            note.lyric().ifPresent(lyric -> target.add(event(measure.number(), note.beat(), lyric)));
        }
    }

    private void collectExpressions(Measure measure, List<AnnotationEvent> target) {
        for (TextExpression expression : measure.expressions()) {
            if (!expression.text().isEmpty()) {
                target.add(event(measure.number(), expression.beat(), expression.text()));
            }
        }
    }

    private AnnotationEvent event(int measure, Rational beat, String text) {
        String value = adaptText ? TextCanonicalizer.canonicalize(text) : text;
        return new AnnotationEvent(new Position(measure, beat), value);
    }
}
