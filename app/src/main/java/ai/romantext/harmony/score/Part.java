package ai.romantext.harmony.score;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single instrument or voice line of the score.
 */
public record Part(String name, List<Measure> measures) {

    public Part {
        name = name == null ? "" : name;
        measures = List.copyOf(Objects.requireNonNull(measures, "measures"));
    }

    public Optional<Measure> measure(int number) {
        return measures.stream().filter(measure -> measure.number() == number).findFirst();
    }
}
