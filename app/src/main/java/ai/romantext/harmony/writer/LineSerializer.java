package ai.romantext.harmony.writer;

import ai.romantext.harmony.repeat.RepeatRange;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lays out the RomanText body measure by measure: time signature changes first, then repeat shorthand,
 * then the measure's analysis line.
 *
 * <p>In template mode every measure gets an empty {@code m<n> b1} line. Otherwise measures without
 * analysis are left out, the prevailing harmony continuing implicitly.
 */
public class LineSerializer {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineSerializer.class);

    private final int firstMeasure;
    private final int lastMeasure;

    public LineSerializer(int firstMeasure, int lastMeasure) {
        if (firstMeasure != 0 && firstMeasure != 1) {
            throw new InvalidFirstMeasureException(firstMeasure);
        }
        if (lastMeasure < firstMeasure) {
            throw new IllegalArgumentException("last measure " + lastMeasure + " precedes first measure " + firstMeasure);
        }
        this.firstMeasure = firstMeasure;
        this.lastMeasure = lastMeasure;
    }

    public List<DocumentLine> serialize(Map<Integer, String> timeSignatures,
                                        Map<Integer, RepeatRange> repeats,
                                        Optional<MeasureLines> content,
                                        boolean template) {
        Objects.requireNonNull(timeSignatures, "timeSignatures");
        Objects.requireNonNull(repeats, "repeats");
        Objects.requireNonNull(content, "content");

        List<DocumentLine> lines = new ArrayList<>();
        for (int measure = firstMeasure; measure <= lastMeasure; measure++) {
            String ratio = timeSignatures.get(measure);
            if (ratio != null) {
                lines.add(new DocumentLine.TimeSignatureDirective(ratio));
            }
            RepeatRange repeat = repeats.get(measure);
            if (repeat != null) {
                lines.add(new DocumentLine.RepeatShorthand(repeat));
            }
            if (template) {
                lines.add(new DocumentLine.EmptyMeasureTemplate(measure));
            } else {
                int current = measure;
                content.flatMap(measureLines -> measureLines.line(current))
                        .ifPresent(text -> lines.add(new DocumentLine.MeasureContent(current, text)));
            }
        }
        LOGGER.debug("Serialized measures {}-{} into {} lines", firstMeasure, lastMeasure, lines.size());
        return List.copyOf(lines);
    }

    public static List<String> render(List<DocumentLine> lines) {
        return lines.stream().map(DocumentLine::render).toList();
    }
}
