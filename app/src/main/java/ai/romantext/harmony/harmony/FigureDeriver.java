package ai.romantext.harmony.harmony;

import ai.romantext.harmony.score.ChordEvent;

/**
 * Names the pitch content of a chord as a Roman numeral figure in a key, e.g. {@code V65}.
 */
@FunctionalInterface
public interface FigureDeriver {

    String derive(ChordEvent chord, Key key);
}
