package ai.romantext.harmony.cli;

import ai.romantext.harmony.analysis.RomanTextAnalysis;
import ai.romantext.harmony.config.Config;
import ai.romantext.harmony.config.ConfigLoader;
import ai.romantext.harmony.config.SystemEnvironmentReader;
import ai.romantext.harmony.harmony.InvalidTonicizationException;
import ai.romantext.harmony.logging.LoggingConfigurator;
import ai.romantext.harmony.repeat.InvalidSelectorException;
import ai.romantext.harmony.score.JsonScoreSource;
import ai.romantext.harmony.score.Score;
import ai.romantext.harmony.score.ScoreFormatException;
import ai.romantext.harmony.score.ScoreSource;
import ai.romantext.harmony.writer.InvalidFirstMeasureException;
import ai.romantext.harmony.writer.RomanTextDocument;
import ai.romantext.harmony.writer.RomanTextWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and analysis pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final ScoreSource scoreSource;
    private final RomanTextWriter writer;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new JsonScoreSource(), new RomanTextWriter());
    }

    CliApplication(ConfigLoader configLoader, ScoreSource scoreSource, RomanTextWriter writer) {
        this.configLoader = configLoader;
        this.scoreSource = scoreSource;
        this.writer = writer;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | InvalidSelectorException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());

        MDC.put("score", config.scorePath().toString());
        MDC.put("mode", config.mode().name().toLowerCase());
        try {
            Path written = compile(config);
            LOGGER.info("RomanText document ready: {}", written);
            return 0;
        } catch (ScoreFormatException | InvalidFirstMeasureException | InvalidSelectorException
                 | InvalidTonicizationException ex) {
            LOGGER.error("Analysis failed: {}", ex.getMessage());
            return EXIT_FAILURE;
        } catch (UncheckedIOException | IllegalStateException | IllegalArgumentException ex) {
            LOGGER.error("Analysis failed", ex);
            return EXIT_FAILURE;
        } finally {
            MDC.remove("score");
            MDC.remove("mode");
        }
    }

    private Path compile(Config config) {
        LOGGER.info("Compiling {} in {} mode", config.scorePath(), config.mode().name().toLowerCase());
        Score score = scoreSource.load(config.scorePath());
        RomanTextDocument document = new RomanTextAnalysis(score, config.analysisOptions()).compile(config.mode());
        String fileStem = config.fileName().orElseGet(() -> document.preamble().fileStem());
        return writer.write(config.outputDirectory(), fileStem, document);
    }
}
