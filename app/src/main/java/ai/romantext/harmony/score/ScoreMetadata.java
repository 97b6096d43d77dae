package ai.romantext.harmony.score;

import java.util.Optional;

/**
 * Bibliographic fields carried by the score itself.
 */
public record ScoreMetadata(Optional<String> composer,
                            Optional<String> title,
                            Optional<String> movementNumber,
                            Optional<String> movementName) {

    public ScoreMetadata {
        composer = normalize(composer);
        title = normalize(title);
        movementNumber = normalize(movementNumber);
        movementName = normalize(movementName);
    }

    public static ScoreMetadata empty() {
        return new ScoreMetadata(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    private static Optional<String> normalize(Optional<String> value) {
        return value == null ? Optional.empty() : value.map(String::trim).filter(v -> !v.isEmpty());
    }
}
