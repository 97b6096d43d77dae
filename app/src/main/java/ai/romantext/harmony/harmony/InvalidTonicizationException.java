package ai.romantext.harmony.harmony;

/**
 * Raised when a tonicization label cannot serve as a local key. Aborts the analysis run.
 */
public class InvalidTonicizationException extends RuntimeException {

    public InvalidTonicizationException(String message) {
        super(message);
    }

    public InvalidTonicizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
