package ai.romantext.harmony.score;

import java.nio.file.Path;

/**
 * Supplies an extracted score for analysis.
 */
@FunctionalInterface
public interface ScoreSource {

    Score load(Path path);
}
