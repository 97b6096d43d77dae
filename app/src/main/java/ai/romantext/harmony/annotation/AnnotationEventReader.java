package ai.romantext.harmony.annotation;

import java.util.List;

/**
 * Supplies analyst annotations in strictly increasing position order, one per position.
 */
public interface AnnotationEventReader {

    List<AnnotationEvent> read();
}
