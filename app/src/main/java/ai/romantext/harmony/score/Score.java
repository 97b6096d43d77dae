package ai.romantext.harmony.score;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Already-extracted symbolic score: parts from top to bottom, plus time signatures and metadata.
 */
public record Score(ScoreMetadata metadata, List<TimeSignature> timeSignatures, List<Part> parts) {

    public Score {
        metadata = metadata == null ? ScoreMetadata.empty() : metadata;
        timeSignatures = timeSignatures == null ? List.of() : List.copyOf(timeSignatures);
        parts = List.copyOf(Objects.requireNonNull(parts, "parts"));
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("score must contain at least one part");
        }
        if (parts.get(0).measures().isEmpty()) {
            throw new IllegalArgumentException("score must contain at least one measure");
        }
    }

    public int partCount() {
        return parts.size();
    }

    public int firstMeasureNumber() {
        return parts.get(0).measures().get(0).number();
    }

    public int lastMeasureNumber() {
        List<Measure> measures = parts.get(0).measures();
        return measures.get(measures.size() - 1).number();
    }

    /**
     * Time signature ratios keyed by the measure where each takes effect.
     */
    public SortedMap<Integer, String> timeSignatureChanges() {
        SortedMap<Integer, String> changes = new TreeMap<>();
        for (TimeSignature timeSignature : timeSignatures) {
            changes.put(timeSignature.measure(), timeSignature.ratio());
        }
        return Collections.unmodifiableSortedMap(changes);
    }
}
