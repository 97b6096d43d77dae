package ai.romantext.harmony.writer;

/**
 * Raised when a score starts on a measure other than 1, or 0 for an anacrusis.
 */
public class InvalidFirstMeasureException extends RuntimeException {

    public InvalidFirstMeasureException(int firstMeasure) {
        super("The first measure number should be 1, or 0 for anacruses. It is currently " + firstMeasure + ".");
    }
}
