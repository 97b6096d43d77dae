package ai.romantext.harmony.harmony;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves Roman numeral tokens on the key's scale.
 *
 * <p>Upper-case numerals denote major triads and lower-case ones minor triads unless a quality mark
 * ({@code o}, {@code ø}, {@code +}) follows. In minor keys an unaltered lower-case sixth or seventh degree
 * is built on the raised scale step, an upper-case one on the natural step.
 */
public class DiatonicDegreeResolver implements ScaleDegreeResolver {

    private static final Pattern TOKEN = Pattern.compile(
            "^([#b-]*)(VII|VI|V|IV|III|II|I|vii|vi|v|iv|iii|ii|i)([oø+]?)(\\d*)$");
    private static final List<String> NUMERALS = List.of("I", "II", "III", "IV", "V", "VI", "VII");

    @Override
    public ResolvedDegree resolve(String token, Key key) {
        String value = token == null ? "" : token.strip();
        Matcher matcher = TOKEN.matcher(value);
        if (!matcher.matches()) {
            throw new InvalidTonicizationException("Unreadable Roman numeral '" + token + "'");
        }
        String prefix = matcher.group(1);
        String numeral = matcher.group(2);
        boolean lowerCase = Character.isLowerCase(numeral.charAt(0));
        int degree = NUMERALS.indexOf(numeral.toUpperCase()) + 1;

        PitchName base = key.degree(degree, lowerCase && prefix.isEmpty());
        int shift = 0;
        for (char ch : prefix.toCharArray()) {
            shift += ch == '#' ? 1 : -1;
        }
        PitchName root = new PitchName(base.step(), base.alter() + shift);
        return new ResolvedDegree(root, quality(matcher.group(3), lowerCase));
    }

    private static ChordQuality quality(String mark, boolean lowerCase) {
        return switch (mark) {
            case "o" -> ChordQuality.DIMINISHED;
            case "ø" -> ChordQuality.HALF_DIMINISHED;
            case "+" -> ChordQuality.AUGMENTED;
            default -> lowerCase ? ChordQuality.MINOR : ChordQuality.MAJOR;
        };
    }
}
