package ai.romantext.harmony.analysis;

import ai.romantext.harmony.annotation.AnnotationTextClass;
import ai.romantext.harmony.repeat.PartSelector;
import ai.romantext.harmony.writer.AnalysisMetadata;
import ai.romantext.harmony.writer.BeatFormatter;
import java.util.Objects;

/**
 * Settings for one analysis run.
 *
 * @param analysisPart part carrying the annotations; negative values count from the bottom
 * @param templateParts parts compared when looking for repeated passages
 * @param detectRepeats whether to emit repeat shorthand at all
 * @param ignoreParts number of top parts left out of the reduction in partial mode
 */
public record AnalysisOptions(int analysisPart,
                              AnnotationTextClass annotationTextClass,
                              boolean adaptText,
                              PartSelector templateParts,
                              boolean detectRepeats,
                              int repeatThreshold,
                              int ignoreParts,
                              boolean tonicizationsPersist,
                              int beatPrecision,
                              AnalysisMetadata metadata) {

    public AnalysisOptions {
        Objects.requireNonNull(annotationTextClass, "annotationTextClass");
        Objects.requireNonNull(templateParts, "templateParts");
        metadata = metadata == null ? AnalysisMetadata.empty() : metadata;
        if (repeatThreshold < 1) {
            throw new IllegalArgumentException("repeatThreshold must be at least 1");
        }
        if (ignoreParts < 0) {
            throw new IllegalArgumentException("ignoreParts must not be negative");
        }
        if (beatPrecision < 0) {
            throw new IllegalArgumentException("beatPrecision must not be negative");
        }
    }

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(-1, AnnotationTextClass.LYRIC, true, PartSelector.all(), true, 1, 2, false,
                BeatFormatter.DEFAULT_PRECISION, AnalysisMetadata.empty());
    }
}
