package ai.romantext.harmony.harmony;

/**
 * Reads a Roman numeral token such as {@code ii} or {@code bVI} against a key.
 */
@FunctionalInterface
public interface ScaleDegreeResolver {

    ResolvedDegree resolve(String token, Key key);
}
