package ai.romantext.harmony.repeat;

import ai.romantext.harmony.score.Measure;
import ai.romantext.harmony.score.Note;
import ai.romantext.harmony.score.Part;
import ai.romantext.harmony.score.Pitch;
import ai.romantext.harmony.score.Rational;
import ai.romantext.harmony.score.Score;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pitch and rhythm content of one measure across all parts, without lyrics or text.
 */
public record StructuralMeasure(int number, List<List<Sound>> parts) {

    /**
     * A note, chord or rest reduced to onset, duration and pitches.
     */
    public record Sound(Rational beat, Rational duration, List<Pitch> pitches) {

        public Sound {
            Objects.requireNonNull(beat, "beat");
            Objects.requireNonNull(duration, "duration");
            pitches = List.copyOf(pitches);
        }
    }

    public StructuralMeasure {
        parts = parts.stream().map(List::copyOf).toList();
    }

    /**
     * One entry per measure of the top part; parts lacking a measure contribute no sounds to it.
     */
    public static List<StructuralMeasure> of(Score score) {
        List<StructuralMeasure> measures = new ArrayList<>();
        for (Measure measure : score.parts().get(0).measures()) {
            List<List<Sound>> parts = new ArrayList<>(score.partCount());
            for (Part part : score.parts()) {
                parts.add(part.measure(measure.number()).map(StructuralMeasure::sounds).orElse(List.of()));
            }
            measures.add(new StructuralMeasure(measure.number(), parts));
        }
        return measures;
    }

    private static List<Sound> sounds(Measure measure) {
        List<Sound> sounds = new ArrayList<>(measure.notes().size());
        for (Note note : measure.notes()) {
            sounds.add(new Sound(note.beat(), note.duration(), note.pitches()));
        }
        return sounds;
    }
}
