package ai.romantext.harmony.writer;

import ai.romantext.harmony.score.Position;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Per-measure RomanText lines such as {@code m15 b1 V b2 iio b3 V7}, built from position-ordered labels.
 */
public final class MeasureLines {

    private final SortedMap<Integer, String> lines;

    private MeasureLines(SortedMap<Integer, String> lines) {
        this.lines = Collections.unmodifiableSortedMap(lines);
    }

    /**
     * Accumulates {@code " b<beat> <label>"} segments onto a line opened with {@code m<measure>} for each measure.
     */
    public static <T> MeasureLines from(List<T> entries,
                                        Function<T, Position> position,
                                        Function<T, String> label,
                                        BeatFormatter beatFormatter) {
        Objects.requireNonNull(entries, "entries");
        Objects.requireNonNull(beatFormatter, "beatFormatter");
        SortedMap<Integer, StringBuilder> builders = new TreeMap<>();
        for (T entry : entries) {
            Position at = position.apply(entry);
            StringBuilder line = builders.computeIfAbsent(at.measure(), measure -> new StringBuilder("m" + measure));
            line.append(" b").append(beatFormatter.format(at.beat())).append(' ').append(label.apply(entry));
        }
        SortedMap<Integer, String> lines = new TreeMap<>();
        for (Map.Entry<Integer, StringBuilder> entry : builders.entrySet()) {
            lines.put(entry.getKey(), entry.getValue().toString());
        }
        return new MeasureLines(lines);
    }

    public Optional<String> line(int measure) {
        return Optional.ofNullable(lines.get(measure));
    }

    public int size() {
        return lines.size();
    }
}
