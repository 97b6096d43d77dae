package ai.romantext.harmony.config;

import ai.romantext.harmony.analysis.AnalysisMode;
import ai.romantext.harmony.analysis.AnalysisOptions;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path scorePath,
        Path outputDirectory,
        Optional<String> fileName,
        AnalysisMode mode,
        LogFormat logFormat,
        AnalysisOptions analysisOptions
) {

    public Config {
        Objects.requireNonNull(scorePath, "scorePath");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        fileName = fileName == null ? Optional.empty() : fileName.map(String::trim).filter(name -> !name.isEmpty());
        fileName.ifPresent(Config::requirePlainFileName);
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(analysisOptions, "analysisOptions");
    }

    private static void requirePlainFileName(String name) {
        if (name.contains("/") || name.contains("\\")) {
            throw new IllegalArgumentException("file name must not contain path separators: " + name);
        }
    }
}
