package ai.romantext.harmony.writer;

import java.util.List;
import java.util.Optional;

/**
 * Preamble fields supplied by the analyst; each one overrides what the score itself says.
 */
public record AnalysisMetadata(Optional<String> composer,
                               Optional<String> title,
                               Optional<String> analyst,
                               Optional<String> proofreader,
                               List<String> notes) {

    public AnalysisMetadata {
        composer = normalize(composer);
        title = normalize(title);
        analyst = normalize(analyst);
        proofreader = normalize(proofreader);
        notes = notes == null ? List.of() : notes.stream().filter(note -> note != null && !note.isBlank()).toList();
    }

    public static AnalysisMetadata empty() {
        return new AnalysisMetadata(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), List.of());
    }

    private static Optional<String> normalize(Optional<String> value) {
        return value == null ? Optional.empty() : value.map(String::trim).filter(v -> !v.isEmpty());
    }
}
