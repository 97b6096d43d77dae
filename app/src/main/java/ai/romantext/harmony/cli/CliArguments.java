package ai.romantext.harmony.cli;

import ai.romantext.harmony.analysis.AnalysisMode;
import ai.romantext.harmony.annotation.AnnotationTextClass;
import ai.romantext.harmony.config.LogFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "skeleton-harmony", mixinStandardHelpOptions = true,
        description = "Compiles a score extract into a RomanText template or analysis")
public class CliArguments {

    @CommandLine.Option(names = "--score", description = "Score extract (JSON) to analyse", paramLabel = "FILE")
    private Path scorePath;

    @CommandLine.Option(names = "--output-dir", description = "Directory receiving the RomanText file", paramLabel = "DIR")
    private Path outputDirectory;

    @CommandLine.Option(names = "--file-name", description = "File stem to use instead of <composer>_-_<title>", paramLabel = "NAME")
    private String fileName;

    @CommandLine.Option(names = "--mode", converter = AnalysisModeConverter.class,
            description = "Document kind: template, full or partial")
    private AnalysisMode mode;

    @CommandLine.Option(names = "--analysis-part", description = "Part carrying the annotations; negative counts from the bottom",
            paramLabel = "INDEX")
    private Integer analysisPart;

    @CommandLine.Option(names = "--annotation-class", converter = AnnotationTextClassConverter.class,
            description = "Annotation source: lyric or text-expression")
    private AnnotationTextClass annotationTextClass;

    @CommandLine.Option(names = "--no-adapt-text", description = "Keep annotation text exactly as written")
    private boolean noAdaptText;

    @CommandLine.Option(names = "--template-parts", description = "Parts compared for repeats: all or a comma-separated list",
            paramLabel = "PARTS")
    private String templateParts;

    @CommandLine.Option(names = "--repeat-threshold", description = "Minimum length of a repeated passage in measures",
            paramLabel = "MEASURES")
    private Integer repeatThreshold;

    @CommandLine.Option(names = "--no-repeats", description = "Do not emit repeat shorthand")
    private boolean noRepeats;

    @CommandLine.Option(names = "--ignore-parts", description = "Top parts left out of the chord reduction (partial mode)",
            paramLabel = "COUNT")
    private Integer ignoreParts;

    @CommandLine.Option(names = "--tonicizations-persist", description = "Keep a tonicization active until the next annotation")
    private boolean tonicizationsPersist;

    @CommandLine.Option(names = "--beat-precision", description = "Decimal places for non-integer beats", paramLabel = "DIGITS")
    private Integer beatPrecision;

    @CommandLine.Option(names = "--composer", description = "Composer for the preamble", paramLabel = "NAME")
    private String composer;

    @CommandLine.Option(names = "--title", description = "Title for the preamble", paramLabel = "TITLE")
    private String title;

    @CommandLine.Option(names = "--analyst", description = "Analyst for the preamble", paramLabel = "NAME")
    private String analyst;

    @CommandLine.Option(names = "--proofreader", description = "Proofreader for the preamble", paramLabel = "NAME")
    private String proofreader;

    @CommandLine.Option(names = "--note", description = "Preamble note; may be repeated", paramLabel = "TEXT")
    private List<String> notes = new ArrayList<>();

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path scorePath() {
        return scorePath;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public String fileName() {
        return fileName;
    }

    public AnalysisMode mode() {
        return mode;
    }

    public Integer analysisPart() {
        return analysisPart;
    }

    public AnnotationTextClass annotationTextClass() {
        return annotationTextClass;
    }

    public boolean noAdaptText() {
        return noAdaptText;
    }

    public String templateParts() {
        return templateParts;
    }

    public Integer repeatThreshold() {
        return repeatThreshold;
    }

    public boolean noRepeats() {
        return noRepeats;
    }

    public Integer ignoreParts() {
        return ignoreParts;
    }

    public boolean tonicizationsPersist() {
        return tonicizationsPersist;
    }

    public Integer beatPrecision() {
        return beatPrecision;
    }

    public String composer() {
        return composer;
    }

    public String title() {
        return title;
    }

    public String analyst() {
        return analyst;
    }

    public String proofreader() {
        return proofreader;
    }

    public List<String> notes() {
        return notes;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
