package ai.romantext.harmony.score;

/**
 * Renders chromatic alterations as repeated accidental symbols.
 */
public final class Accidentals {

    private Accidentals() {
    }

    public static String render(int alter, String sharp, String flat) {
        if (alter == 0) {
            return "";
        }
        return (alter > 0 ? sharp : flat).repeat(Math.abs(alter));
    }
}
