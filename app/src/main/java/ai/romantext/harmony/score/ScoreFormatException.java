package ai.romantext.harmony.score;

/**
 * Runtime exception raised when an extracted score cannot be read.
 */
public class ScoreFormatException extends RuntimeException {

    public ScoreFormatException(String message) {
        super(message);
    }

    public ScoreFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
