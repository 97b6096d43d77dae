package ai.romantext.harmony.cli;

import ai.romantext.harmony.analysis.AnalysisMode;
import picocli.CommandLine;

/**
 * Parses {@code --mode} values.
 */
public class AnalysisModeConverter implements CommandLine.ITypeConverter<AnalysisMode> {
    @Override
    public AnalysisMode convert(String value) {
        return AnalysisMode.from(value);
    }
}
