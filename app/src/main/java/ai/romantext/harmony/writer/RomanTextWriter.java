package ai.romantext.harmony.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes RomanText documents as {@code <stem>.txt}, staging them when the target lies in a git work tree.
 */
public class RomanTextWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(RomanTextWriter.class);

    public Path write(Path outputDirectory, String fileStem, RomanTextDocument document) {
        if (outputDirectory == null || fileStem == null || fileStem.isBlank() || document == null) {
            throw new IllegalArgumentException("outputDirectory, fileStem and document must be provided");
        }
        Path target = outputDirectory.resolve(fileStem + ".txt");
        StringBuilder content = new StringBuilder();
        for (String line : document.lines()) {
            content.append(line).append('\n');
        }
        try {
            Files.createDirectories(outputDirectory);
            Files.writeString(target, content, StandardCharsets.UTF_8);
            stageIfRepository(target);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write RomanText document: " + target, ex);
        }
        LOGGER.info("Wrote {} ({} lines)", target, document.lines().size());
        return target;
    }

    private void stageIfRepository(Path target) throws IOException {
        FileRepositoryBuilder builder = new FileRepositoryBuilder().findGitDir(target.getParent().toFile());
        if (builder.getGitDir() == null) {
            return;
        }
        try (Repository repository = builder.build(); Git git = new Git(repository)) {
            if (repository.isBare()) {
                return;
            }
            Path workTree = repository.getWorkTree().toPath().toRealPath();
            String relativePath = workTree.relativize(target.toRealPath()).toString().replace('\\', '/');
            git.add().addFilepattern(relativePath).call();
            LOGGER.debug("Staged {} in {}", relativePath, workTree);
        } catch (GitAPIException ex) {
            throw new IllegalStateException("Failed to stage RomanText document: " + target, ex);
        }
    }
}
