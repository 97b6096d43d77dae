package ai.romantext.harmony.text;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Repairs free-text analyst annotations into the strict Roman numeral syntax of RomanText.
 *
 * <p>Only accidentals ({@code # b -}), qualities ({@code + o ø}), the colon, brackets, slash,
 * the note letters a-g, the numeral letters i and v, the {@code n} of {@code [no3]} and digits
 * survive, compared case-insensitively. Every colon ends up followed by exactly one space.
 */
public final class TextCanonicalizer {

    private static final Map<String, String> SUBSTITUTIONS = new LinkedHashMap<>();
    private static final String ALLOWED = "#b-+oø:[]/abcdefgivn0123456789";

    static {
        SUBSTITUTIONS.put("/o", "ø");
        SUBSTITUTIONS.put("°", "o");
        SUBSTITUTIONS.put("(", "[");
        SUBSTITUTIONS.put(")", "]");
    }

    private TextCanonicalizer() {
    }

    public static String canonicalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String text = substitute(raw);
        StringBuilder kept = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ALLOWED.indexOf(Character.toLowerCase(ch)) >= 0) {
                kept.append(ch);
            }
        }
        // stripping can join a '/' and an 'o' that were apart
        return substitute(kept.toString()).replace(":", ": ");
    }

    private static String substitute(String text) {
        String result = text;
        for (Map.Entry<String, String> entry : SUBSTITUTIONS.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        return result;
    }
}
