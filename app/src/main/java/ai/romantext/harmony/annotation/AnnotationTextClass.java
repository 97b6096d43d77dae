package ai.romantext.harmony.annotation;

/**
 * Where annotations live in the score.
 */
public enum AnnotationTextClass {
    LYRIC,
    TEXT_EXPRESSION;

    public static AnnotationTextClass from(String raw) {
        if (raw == null || raw.isBlank()) {
            return LYRIC;
        }
        String normalized = raw.trim().replace('-', '_');
        for (AnnotationTextClass textClass : values()) {
            if (textClass.name().equalsIgnoreCase(normalized)) {
                return textClass;
            }
        }
        throw new IllegalArgumentException("Unsupported annotation text class: " + raw
                + " (expected lyric or text-expression)");
    }
}
