package ai.romantext.harmony.harmony;

import ai.romantext.harmony.score.Accidentals;
import ai.romantext.harmony.score.Pitch;

/**
 * Octave-less spelled pitch, e.g. the root of a chord or the tonic of a key.
 */
public record PitchName(char step, int alter) {

    public PitchName {
        step = Character.toUpperCase(step);
        if ("CDEFGAB".indexOf(step) < 0) {
            throw new IllegalArgumentException("Invalid pitch step: " + step);
        }
    }

    public static PitchName of(Pitch pitch) {
        return new PitchName(pitch.step(), pitch.alter());
    }

    public int stepIndex() {
        return "CDEFGAB".indexOf(step);
    }

    public int pitchClass() {
        return Math.floorMod(Pitch.naturalPitchClass(step) + alter, 12);
    }

    /**
     * Spells {@code pitchClass} on the given step with the smallest alteration.
     */
    static PitchName spell(char step, int pitchClass) {
        int alter = Math.floorMod(pitchClass - Pitch.naturalPitchClass(step) + 6, 12) - 6;
        return new PitchName(step, alter);
    }

    @Override
    public String toString() {
        return step + Accidentals.render(alter, "#", "b");
    }
}
