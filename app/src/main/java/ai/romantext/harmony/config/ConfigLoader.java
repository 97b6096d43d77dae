package ai.romantext.harmony.config;

import ai.romantext.harmony.analysis.AnalysisMode;
import ai.romantext.harmony.analysis.AnalysisOptions;
import ai.romantext.harmony.annotation.AnnotationTextClass;
import ai.romantext.harmony.cli.CliArguments;
import ai.romantext.harmony.repeat.PartSelector;
import ai.romantext.harmony.writer.AnalysisMetadata;
import ai.romantext.harmony.writer.BeatFormatter;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_SCORE = "RNTXT_SCORE";
    static final String ENV_OUTPUT_DIR = "RNTXT_OUTPUT_DIR";
    static final String ENV_MODE = "RNTXT_MODE";
    static final String ENV_ANALYSIS_PART = "RNTXT_ANALYSIS_PART";
    static final String ENV_ANNOTATION_CLASS = "RNTXT_ANNOTATION_CLASS";
    static final String ENV_ADAPT_TEXT = "RNTXT_ADAPT_TEXT";
    static final String ENV_TEMPLATE_PARTS = "RNTXT_TEMPLATE_PARTS";
    static final String ENV_REPEAT_THRESHOLD = "RNTXT_REPEAT_THRESHOLD";
    static final String ENV_IGNORE_PARTS = "RNTXT_IGNORE_PARTS";
    static final String ENV_TONICIZATIONS_PERSIST = "RNTXT_TONICIZATIONS_PERSIST";
    static final String ENV_BEAT_PRECISION = "RNTXT_BEAT_PRECISION";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_OUTPUT_DIR = ".";
    private static final int DEFAULT_ANALYSIS_PART = -1;
    private static final int DEFAULT_REPEAT_THRESHOLD = 1;
    private static final int DEFAULT_IGNORE_PARTS = 2;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        Path scorePath = Optional.ofNullable(arguments.scorePath())
                .or(() -> env(ENV_SCORE).map(Path::of))
                .orElseThrow(() -> new IllegalArgumentException("score extract must be provided (--score or " + ENV_SCORE + ")"));
        Path outputDirectory = Optional.ofNullable(arguments.outputDirectory())
                .orElseGet(() -> Path.of(env(ENV_OUTPUT_DIR).orElse(DEFAULT_OUTPUT_DIR)));

        AnalysisMode mode = Optional.ofNullable(arguments.mode())
                .orElseGet(() -> env(ENV_MODE).map(AnalysisMode::from).orElse(AnalysisMode.TEMPLATE));
        LogFormat logFormat = Optional.ofNullable(arguments.logFormat())
                .orElseGet(() -> env(ENV_LOG_FORMAT).map(LogFormat::from).orElse(LogFormat.TEXT));

        int analysisPart = resolveInteger(arguments.analysisPart(), ENV_ANALYSIS_PART, DEFAULT_ANALYSIS_PART);
        AnnotationTextClass textClass = Optional.ofNullable(arguments.annotationTextClass())
                .orElseGet(() -> env(ENV_ANNOTATION_CLASS).map(AnnotationTextClass::from).orElse(AnnotationTextClass.LYRIC));
        boolean adaptText = !arguments.noAdaptText() && env(ENV_ADAPT_TEXT).map(ConfigLoader::parseBoolean).orElse(true);
        PartSelector templateParts = Optional.ofNullable(arguments.templateParts())
                .or(() -> env(ENV_TEMPLATE_PARTS))
                .map(PartSelector::parse)
                .orElse(PartSelector.all());

        int repeatThreshold = resolveInteger(arguments.repeatThreshold(), ENV_REPEAT_THRESHOLD, DEFAULT_REPEAT_THRESHOLD);
        if (repeatThreshold < 1) {
            throw new IllegalArgumentException("--repeat-threshold must be at least 1");
        }
        int ignoreParts = resolveInteger(arguments.ignoreParts(), ENV_IGNORE_PARTS, DEFAULT_IGNORE_PARTS);
        if (ignoreParts < 0) {
            throw new IllegalArgumentException("--ignore-parts must be zero or greater");
        }
        int beatPrecision = resolveInteger(arguments.beatPrecision(), ENV_BEAT_PRECISION, BeatFormatter.DEFAULT_PRECISION);
        if (beatPrecision < 0) {
            throw new IllegalArgumentException("--beat-precision must be zero or greater");
        }
        boolean tonicizationsPersist = arguments.tonicizationsPersist()
                || env(ENV_TONICIZATIONS_PERSIST).map(ConfigLoader::parseBoolean).orElse(false);

        AnalysisMetadata metadata = new AnalysisMetadata(
                Optional.ofNullable(arguments.composer()),
                Optional.ofNullable(arguments.title()),
                Optional.ofNullable(arguments.analyst()),
                Optional.ofNullable(arguments.proofreader()),
                arguments.notes());

        AnalysisOptions options = new AnalysisOptions(analysisPart, textClass, adaptText, templateParts,
                !arguments.noRepeats(), repeatThreshold, ignoreParts, tonicizationsPersist, beatPrecision, metadata);
        return new Config(scorePath, outputDirectory, Optional.ofNullable(arguments.fileName()), mode, logFormat, options);
    }

    private Optional<String> env(String key) {
        return environmentReader.setting(key);
    }

    private int resolveInteger(Integer cliValue, String envKey, int defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return env(envKey).map(value -> parseInteger(envKey, value)).orElse(defaultValue);
    }

    private static int parseInteger(String key, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static boolean parseBoolean(String raw) {
        return raw.equalsIgnoreCase("true") || raw.equals("1");
    }
}
