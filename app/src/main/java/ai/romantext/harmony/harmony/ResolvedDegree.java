package ai.romantext.harmony.harmony;

import java.util.Objects;

/**
 * Root and triad quality of a Roman numeral degree read against a key.
 */
public record ResolvedDegree(PitchName root, ChordQuality quality) {

    public ResolvedDegree {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(quality, "quality");
    }
}
