package ai.romantext.harmony.score;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces the lower parts of a score to one chord per note onset.
 *
 * <p>Ties across bar lines are not followed: a note sounds only within its own measure.
 */
public class Chordifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(Chordifier.class);

    public List<ChordEvent> chordify(Score score, int ignoreParts) {
        if (ignoreParts < 0 || ignoreParts >= score.partCount()) {
            throw new IllegalArgumentException("ignoreParts must be between 0 and " + (score.partCount() - 1)
                    + " for a score of " + score.partCount() + " parts, got " + ignoreParts);
        }
        List<Part> kept = score.parts().subList(ignoreParts, score.partCount());

        SortedSet<Integer> measureNumbers = new TreeSet<>();
        for (Part part : kept) {
            part.measures().forEach(measure -> measureNumbers.add(measure.number()));
        }

        List<ChordEvent> chords = new ArrayList<>();
        for (int number : measureNumbers) {
            List<Measure> slice = new ArrayList<>();
            for (Part part : kept) {
                part.measure(number).ifPresent(slice::add);
            }
            chordifyMeasure(number, slice, chords);
        }
        LOGGER.debug("Reduced {} parts to {} chords", kept.size(), chords.size());
        return chords;
    }

    private void chordifyMeasure(int number, List<Measure> slice, List<ChordEvent> chords) {
        SortedSet<Rational> onsets = new TreeSet<>();
        for (Measure measure : slice) {
            measure.notes().stream()
                    .filter(note -> !note.isRest())
                    .forEach(note -> onsets.add(note.beat()));
        }
        for (Rational onset : onsets) {
            Set<Pitch> sounding = new LinkedHashSet<>();
            for (Measure measure : slice) {
                for (Note note : measure.notes()) {
                    if (!note.isRest() && note.soundsAt(onset)) {
                        sounding.addAll(note.pitches());
                    }
                }
            }
            if (sounding.isEmpty()) {
                continue;
            }
            List<Pitch> ordered = sounding.stream().sorted(Comparator.comparingInt(Pitch::midi)).toList();
            chords.add(new ChordEvent(new Position(number, onset), ordered));
        }
    }
}
