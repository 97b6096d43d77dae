package ai.romantext.harmony.score;

/**
 * Spelled pitch: diatonic step, chromatic alteration and octave.
 *
 * <p>Accepts {@code C4}, {@code F#3}, {@code B-2}, {@code Bb2} and repeated accidentals.
 */
public record Pitch(char step, int alter, int octave) {

    private static final String STEPS = "CDEFGAB";
    private static final int[] NATURAL_PITCH_CLASSES = {0, 2, 4, 5, 7, 9, 11};

    public Pitch {
        step = Character.toUpperCase(step);
        if (STEPS.indexOf(step) < 0) {
            throw new IllegalArgumentException("Invalid pitch step: " + step);
        }
    }

    public static Pitch parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Pitch name must be provided");
        }
        String value = raw.trim();
        char step = value.charAt(0);
        int index = 1;
        int alter = 0;
        while (index < value.length()) {
            char ch = value.charAt(index);
            if (ch == '#') {
                alter++;
            } else if (ch == '-' || ch == 'b') {
                alter--;
            } else {
                break;
            }
            index++;
        }
        if (index >= value.length()) {
            throw new IllegalArgumentException("Pitch octave missing: " + raw);
        }
        try {
            return new Pitch(step, alter, Integer.parseInt(value.substring(index)));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid pitch octave: " + raw, ex);
        }
    }

    /**
     * Index of the step within C..B, 0 to 6.
     */
    public int stepIndex() {
        return STEPS.indexOf(step);
    }

    public int pitchClass() {
        return Math.floorMod(naturalPitchClass(step) + alter, 12);
    }

    public int midi() {
        return (octave + 1) * 12 + naturalPitchClass(step) + alter;
    }

    public static int naturalPitchClass(char step) {
        return NATURAL_PITCH_CLASSES[STEPS.indexOf(Character.toUpperCase(step))];
    }

    public static char stepAt(int index) {
        return STEPS.charAt(Math.floorMod(index, 7));
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder().append(step);
        builder.append(Accidentals.render(alter, "#", "-"));
        return builder.append(octave).toString();
    }
}
