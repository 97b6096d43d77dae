package ai.romantext.harmony.harmony;

import ai.romantext.harmony.score.Accidentals;
import ai.romantext.harmony.score.Pitch;
import java.util.Objects;

/**
 * A major or minor key. The text form encodes the mode in the case of the tonic: {@code G}, {@code g}, {@code Bb}, {@code f#}.
 */
public record Key(PitchName tonic, KeyMode mode) {

    private static final int[] MAJOR_SCALE = {0, 2, 4, 5, 7, 9, 11};
    private static final int[] NATURAL_MINOR_SCALE = {0, 2, 3, 5, 7, 8, 10};

    public Key {
        Objects.requireNonNull(tonic, "tonic");
        Objects.requireNonNull(mode, "mode");
    }

    /**
     * Parses a key label as written by analysts, tolerating a trailing colon and surrounding spaces.
     */
    public static Key parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Key label must be provided");
        }
        String label = raw.strip();
        while (label.endsWith(":")) {
            label = label.substring(0, label.length() - 1).strip();
        }
        if (label.isEmpty() || "ABCDEFGabcdefg".indexOf(label.charAt(0)) < 0) {
            throw new IllegalArgumentException("Invalid key label: '" + raw + "'");
        }
        char letter = label.charAt(0);
        int alter = 0;
        for (int i = 1; i < label.length(); i++) {
            switch (label.charAt(i)) {
                case '#' -> alter++;
                case 'b', '-' -> alter--;
                default -> throw new IllegalArgumentException("Invalid key label: '" + raw + "'");
            }
        }
        KeyMode mode = Character.isUpperCase(letter) ? KeyMode.MAJOR : KeyMode.MINOR;
        return new Key(new PitchName(letter, alter), mode);
    }

    /**
     * Root of scale degree 1 to 7. In minor keys, {@code raised} selects the leading-tone forms of degrees 6 and 7.
     */
    public PitchName degree(int degree, boolean raised) {
        if (degree < 1 || degree > 7) {
            throw new IllegalArgumentException("degree must be between 1 and 7");
        }
        int offset = scale()[degree - 1];
        if (mode == KeyMode.MINOR && raised && degree >= 6) {
            offset++;
        }
        char step = Pitch.stepAt(tonic.stepIndex() + degree - 1);
        return PitchName.spell(step, tonic.pitchClass() + offset);
    }

    /**
     * Diatonic spelling of {@code step} in this key's signature.
     */
    public PitchName diatonic(char step) {
        int degree = Math.floorMod("CDEFGAB".indexOf(Character.toUpperCase(step)) - tonic.stepIndex(), 7) + 1;
        return degree(degree, false);
    }

    private int[] scale() {
        return mode == KeyMode.MAJOR ? MAJOR_SCALE : NATURAL_MINOR_SCALE;
    }

    @Override
    public String toString() {
        char letter = mode == KeyMode.MAJOR ? tonic.step() : Character.toLowerCase(tonic.step());
        return letter + Accidentals.render(tonic.alter(), "#", "b");
    }
}
