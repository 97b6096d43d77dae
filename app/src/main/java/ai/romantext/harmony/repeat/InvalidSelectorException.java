package ai.romantext.harmony.repeat;

/**
 * Raised for a malformed part selection.
 */
public class InvalidSelectorException extends RuntimeException {

    public InvalidSelectorException(String message) {
        super(message);
    }

    public InvalidSelectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
