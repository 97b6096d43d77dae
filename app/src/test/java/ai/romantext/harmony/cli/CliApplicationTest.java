package ai.romantext.harmony.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.romantext.harmony.config.ConfigLoader;
import ai.romantext.harmony.score.JsonScoreSource;
import ai.romantext.harmony.writer.RomanTextWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final String SCORE = """
            {
              "metadata": {"composer": "Anon", "title": "Study"},
              "timeSignatures": [{"measure": 1, "ratio": "3/4"}],
              "parts": [
                {"name": "Piano", "measures": [
                  {"number": 1, "notes": [{"beat": "1", "duration": "3", "pitches": ["C4", "E4", "G4"]}]},
                  {"number": 2, "notes": [{"beat": "1", "duration": "3", "pitches": ["G3", "B3", "D4"]}]}
                ]},
                {"name": "Reduction", "measures": [
                  {"number": 1, "notes": [{"beat": "1", "duration": "3", "pitches": ["C3", "E3", "G3"], "lyric": "%s"}]},
                  {"number": 2, "notes": [{"beat": "1", "duration": "3", "pitches": ["G2", "B2", "D3"], "lyric": "%s"}]}
                ]}
              ]
            }
            """;

    @TempDir
    Path tempDir;

    @Test
    void writesTemplateNamedAfterScoreMetadata() throws Exception {
        Path score = writeScore("C:", "V");

        int exitCode = application().run(new String[] {
                "--score", score.toString(), "--output-dir", tempDir.resolve("out").toString()});

        assertThat(exitCode).isZero();
        Path written = tempDir.resolve("out/Anon_-_Study.txt");
        assertThat(Files.readAllLines(written, StandardCharsets.UTF_8))
                .endsWith("", "Time Signature: 3/4", "m1 b1", "m2 b1");
    }

    @Test
    void writesDeducedAnalysisUnderRequestedFileName() throws Exception {
        Path score = writeScore("C:", "/V");

        int exitCode = application().run(new String[] {
                "--score", score.toString(), "--output-dir", tempDir.toString(), "--file-name", "study",
                "--mode", "partial", "--ignore-parts", "1"});

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(tempDir.resolve("study.txt"), StandardCharsets.UTF_8))
                .endsWith("m1 b1 C: I", "m2 b1 I/V");
    }

    @Test
    void returnsFailureWhenTonicizationIsUnusable() throws Exception {
        Path score = writeScore("C:", "/viio");

        int exitCode = application().run(new String[] {
                "--score", score.toString(), "--output-dir", tempDir.toString(), "--mode", "partial",
                "--ignore-parts", "1"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(Files.exists(tempDir.resolve("Anon_-_Study.txt"))).isFalse();
    }

    @Test
    void returnsFailureWhenScoreCannotBeRead() {
        int exitCode = application().run(new String[] {"--score", tempDir.resolve("missing.json").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
    }

    @Test
    void rejectsInvalidInputWithUsageExitCode() {
        CliApplication application = application();

        assertThat(application.run(new String[] {"--mode", "sketch", "--score", "x.json"})).isEqualTo(2);
        assertThat(application.run(new String[] {"--unknown"})).isEqualTo(2);
        assertThat(application.run(new String[0])).isEqualTo(2);
        assertThat(application.run(new String[] {"--score", "x.json", "--template-parts", "bass"})).isEqualTo(2);
    }

    @Test
    void printsHelp() {
        assertThat(application().run(new String[] {"--help"})).isZero();
    }

    private Path writeScore(String firstLyric, String secondLyric) throws Exception {
        Path file = tempDir.resolve("study.json");
        Files.writeString(file, SCORE.formatted(firstLyric, secondLyric), StandardCharsets.UTF_8);
        return file;
    }

    private static CliApplication application() {
        return new CliApplication(new ConfigLoader(key -> Optional.empty()), new JsonScoreSource(), new RomanTextWriter());
    }
}
