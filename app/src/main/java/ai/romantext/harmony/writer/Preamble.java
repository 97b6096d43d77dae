package ai.romantext.harmony.writer;

import ai.romantext.harmony.score.ScoreMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Metadata header of a RomanText document, plus the file stem derived from it.
 *
 * <p>Analyst-supplied values win over the score's own metadata; anything still missing is left blank in
 * the header and named {@code Unknown} elsewhere. The header ends with two empty lines.
 */
public record Preamble(List<String> lines, String fileStem) {

    private static final String UNKNOWN = "Unknown";

    public Preamble {
        lines = List.copyOf(lines);
    }

    public static Preamble from(ScoreMetadata score, AnalysisMetadata analysis) {
        List<String> lines = new ArrayList<>();

        Optional<String> composer = analysis.composer().or(score::composer);
        lines.add("Composer: " + composer.orElse(""));

        Optional<String> title = analysis.title().or(() -> workingTitle(score));
        lines.add("Title: " + title.orElse(""));

        lines.add("Analyst: " + analysis.analyst().orElse(UNKNOWN));
        lines.add("Proofreader: " + analysis.proofreader().orElse(UNKNOWN));
        for (String note : analysis.notes()) {
            lines.add("Note: " + note);
        }
        lines.add("");
        lines.add("");

        String stem = composer.orElse(UNKNOWN) + "_-_" + title.map(Preamble::fileSafe).orElse(UNKNOWN);
        return new Preamble(lines, stem);
    }

    private static Optional<String> workingTitle(ScoreMetadata score) {
        List<String> parts = new ArrayList<>();
        score.title().ifPresent(parts::add);
        score.movementNumber().ifPresent(number -> parts.add("- No." + number + ":"));
        score.movementName()
                .filter(name -> !name.equals(score.title().orElse(null)))
                .ifPresent(parts::add);
        return parts.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", parts));
    }

    private static String fileSafe(String title) {
        return title.replace(".", "").replace(":", "").replace(' ', '_');
    }
}
