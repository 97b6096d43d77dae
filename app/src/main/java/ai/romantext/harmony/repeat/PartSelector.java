package ai.romantext.harmony.repeat;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Which parts of the score take part in repeat detection: all of them, or specific part indices counted from 0 at the top.
 */
public sealed interface PartSelector permits PartSelector.AllParts, PartSelector.SpecificParts {

    String USAGE = "part selection must be 'all' or a list of non-negative part numbers counted from 0";

    static PartSelector all() {
        return AllParts.INSTANCE;
    }

    static PartSelector specific(Collection<Integer> indices) {
        if (indices == null) {
            throw new InvalidSelectorException(USAGE + ", got null");
        }
        SortedSet<Integer> sorted = new TreeSet<>();
        for (Integer index : indices) {
            if (index == null || index < 0) {
                throw new InvalidSelectorException(USAGE + ", got " + index);
            }
            sorted.add(index);
        }
        return new SpecificParts(sorted);
    }

    /**
     * Parses {@code all} or a comma-separated list such as {@code 0,1}.
     */
    static PartSelector parse(String raw) {
        if (raw == null || raw.isBlank() || raw.strip().equalsIgnoreCase("all")) {
            return all();
        }
        List<Integer> indices = new ArrayList<>();
        for (String token : raw.split(",")) {
            try {
                indices.add(Integer.parseInt(token.strip()));
            } catch (NumberFormatException ex) {
                throw new InvalidSelectorException(USAGE + ", got '" + raw + "'", ex);
            }
        }
        return specific(indices);
    }

    <T> List<T> select(List<T> parts);

    final class AllParts implements PartSelector {

        private static final AllParts INSTANCE = new AllParts();

        private AllParts() {
        }

        @Override
        public <T> List<T> select(List<T> parts) {
            return parts;
        }

        @Override
        public String toString() {
            return "all";
        }
    }

    record SpecificParts(SortedSet<Integer> indices) implements PartSelector {

        public SpecificParts {
            if (indices == null || indices.isEmpty()) {
                throw new InvalidSelectorException(USAGE + ", got no part numbers");
            }
            for (Integer index : indices) {
                if (index == null || index < 0) {
                    throw new InvalidSelectorException(USAGE + ", got " + index);
                }
            }
            indices = Collections.unmodifiableSortedSet(new TreeSet<>(indices));
        }

        @Override
        public <T> List<T> select(List<T> parts) {
            List<T> selected = new ArrayList<>(indices.size());
            for (int index : indices) {
                if (index < parts.size()) {
                    selected.add(parts.get(index));
                }
            }
            return selected;
        }
    }
}
