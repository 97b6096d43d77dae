package ai.romantext.harmony.repeat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds passages that repeat earlier material exactly, so the analysis can refer back instead of repeating itself.
 *
 * <p>Equality covers pitches and rhythm only. A key or time signature in force at the start of a target
 * passage is not compared, so analysts should restate the key at the start of, and after, every repeat.
 */
public class RepeatRangeDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(RepeatRangeDetector.class);

    public SortedMap<Integer, RepeatRange> detect(List<StructuralMeasure> measures, PartSelector selector) {
        return detect(measures, selector, 1);
    }

    /**
     * Returns repeat ranges keyed by target start. Each target is a maximal run of at least
     * {@code threshold} measures equal to an earlier, non-overlapping run; when several earlier runs
     * match, the earliest wins. Target extents never overlap.
     */
    public SortedMap<Integer, RepeatRange> detect(List<StructuralMeasure> measures, PartSelector selector, int threshold) {
        Objects.requireNonNull(measures, "measures");
        Objects.requireNonNull(selector, "selector");
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be at least 1");
        }
        int[] fingerprints = fingerprint(measures, selector);
        int count = fingerprints.length;

        TreeMap<Integer, RepeatRange> ranges = new TreeMap<>();
        for (int source = 0; source < count; source++) {
            for (int target = source + 1; target < count; target++) {
                if (fingerprints[source] != fingerprints[target]) {
                    continue;
                }
                if (source > 0 && fingerprints[source - 1] == fingerprints[target - 1]) {
                    continue;
                }
                int length = 0;
                while (source + length < target && target + length < count
                        && fingerprints[source + length] == fingerprints[target + length]) {
                    length++;
                }
                if (length < threshold) {
                    continue;
                }
                RepeatRange candidate = new RepeatRange(
                        measures.get(target).number(), measures.get(target + length - 1).number(),
                        measures.get(source).number(), measures.get(source + length - 1).number());
                accept(ranges, candidate);
            }
        }
        LOGGER.info("Found {} repeated passages across {} measures (parts: {}, threshold {})",
                ranges.size(), count, selector, threshold);
        return Collections.unmodifiableSortedMap(ranges);
    }

    private static void accept(TreeMap<Integer, RepeatRange> ranges, RepeatRange candidate) {
        if (ranges.containsKey(candidate.targetStart())) {
            return;
        }
        Map.Entry<Integer, RepeatRange> before = ranges.floorEntry(candidate.targetStart());
        Map.Entry<Integer, RepeatRange> after = ranges.ceilingEntry(candidate.targetStart());
        if ((before != null && before.getValue().overlapsTarget(candidate))
                || (after != null && after.getValue().overlapsTarget(candidate))) {
            LOGGER.debug("Dropping {} overlapping an earlier repeat", candidate);
            return;
        }
        ranges.put(candidate.targetStart(), candidate);
    }

    private static int[] fingerprint(List<StructuralMeasure> measures, PartSelector selector) {
        Map<List<List<StructuralMeasure.Sound>>, Integer> ids = new HashMap<>();
        int[] fingerprints = new int[measures.size()];
        boolean anySelected = false;
        for (int i = 0; i < measures.size(); i++) {
            List<List<StructuralMeasure.Sound>> selected = new ArrayList<>(selector.select(measures.get(i).parts()));
            anySelected |= !selected.isEmpty();
            Integer id = ids.get(selected);
            if (id == null) {
                id = ids.size();
                ids.put(selected, id);
            }
            fingerprints[i] = id;
        }
        if (!measures.isEmpty() && !anySelected) {
            throw new InvalidSelectorException("part selection " + selector + " matches none of the score's parts");
        }
        return fingerprints;
    }
}
