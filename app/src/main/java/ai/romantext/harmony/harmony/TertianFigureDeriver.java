package ai.romantext.harmony.harmony;

import ai.romantext.harmony.score.Accidentals;
import ai.romantext.harmony.score.ChordEvent;
import ai.romantext.harmony.score.Pitch;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives figures by stacking the chord's pitches in thirds.
 *
 * <p>The root is the pitch over which every other pitch lies a third, fifth or seventh above; failing
 * that, the pitch explaining most of the others, the bass winning ties. A missing third is taken from
 * the key. Inversions are figured {@code 6}/{@code 64} for triads and {@code 65}/{@code 43}/{@code 42}
 * for seventh chords; a bass that is not a chord member leaves the figure in root position.
 */
public class TertianFigureDeriver implements FigureDeriver {

    private static final String[] NUMERALS = {"I", "II", "III", "IV", "V", "VI", "VII"};
    private static final int THIRD = 2;
    private static final int FIFTH = 4;
    private static final int SEVENTH = 6;

    @Override
    public String derive(ChordEvent chord, Key key) {
        PitchName bass = PitchName.of(chord.bass());
        Set<PitchName> names = new LinkedHashSet<>();
        for (Pitch pitch : chord.pitches()) {
            names.add(PitchName.of(pitch));
        }
        PitchName root = findRoot(new ArrayList<>(names), bass);

        Map<Integer, Integer> members = new HashMap<>();
        for (PitchName name : names) {
            members.putIfAbsent(genericInterval(root, name), semitones(root, name));
        }
        int third = members.containsKey(THIRD) ? members.get(THIRD) : semitones(root, key.diatonic(stepAbove(root, THIRD)));
        int fifth = members.getOrDefault(FIFTH, 7);
        Integer seventh = members.get(SEVENTH);

        ChordQuality quality = triadQuality(third, fifth);
        if (quality == ChordQuality.DIMINISHED && seventh != null && seventh == 10) {
            quality = ChordQuality.HALF_DIMINISHED;
        }

        int degree = Math.floorMod(root.stepIndex() - key.tonic().stepIndex(), 7) + 1;
        PitchName expected = key.degree(degree, !quality.isUpperCase());
        int alteration = Math.floorMod(root.pitchClass() - expected.pitchClass() + 6, 12) - 6;

        StringBuilder figure = new StringBuilder();
        figure.append(Accidentals.render(alteration, "#", "b"));
        String numeral = NUMERALS[degree - 1];
        figure.append(quality.isUpperCase() ? numeral : numeral.toLowerCase());
        figure.append(qualityMark(quality));
        figure.append(inversion(genericInterval(root, bass), seventh != null));
        return figure.toString();
    }

    private static PitchName findRoot(List<PitchName> names, PitchName bass) {
        PitchName best = bass;
        int bestScore = explained(bass, names);
        for (PitchName candidate : names) {
            int score = explained(candidate, names);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best;
    }

    private static int explained(PitchName candidate, List<PitchName> names) {
        int count = 0;
        for (PitchName name : names) {
            int generic = genericInterval(candidate, name);
            if (generic == THIRD || generic == FIFTH || generic == SEVENTH) {
                count++;
            }
        }
        return count;
    }

    private static ChordQuality triadQuality(int third, int fifth) {
        if (third == 3 && fifth == 6) {
            return ChordQuality.DIMINISHED;
        }
        if (third == 4 && fifth == 8) {
            return ChordQuality.AUGMENTED;
        }
        return third <= 3 ? ChordQuality.MINOR : ChordQuality.MAJOR;
    }

    private static String qualityMark(ChordQuality quality) {
        return switch (quality) {
            case DIMINISHED -> "o";
            case HALF_DIMINISHED -> "ø";
            case AUGMENTED -> "+";
            case MAJOR, MINOR -> "";
        };
    }

    private static String inversion(int bassInterval, boolean seventhChord) {
        if (seventhChord) {
            return switch (bassInterval) {
                case THIRD -> "65";
                case FIFTH -> "43";
                case SEVENTH -> "42";
                default -> "7";
            };
        }
        return switch (bassInterval) {
            case THIRD -> "6";
            case FIFTH -> "64";
            default -> "";
        };
    }

    private static int genericInterval(PitchName from, PitchName to) {
        return Math.floorMod(to.stepIndex() - from.stepIndex(), 7);
    }

    private static int semitones(PitchName from, PitchName to) {
        return Math.floorMod(to.pitchClass() - from.pitchClass(), 12);
    }

    private static char stepAbove(PitchName root, int generic) {
        return Pitch.stepAt(root.stepIndex() + generic);
    }
}
