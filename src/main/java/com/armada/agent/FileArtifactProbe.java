package com.armada.agent;

import com.armada.core.model.RunLevel;
import com.armada.core.model.WorkItem;
import com.armada.core.scheduler.ArtifactProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Finds the pull-request file an agent writes on success, e.g. {@code .worktrees/issue-145.pr}.
 * Only issue-level items have such a file. The artifact is the file's first line, or the file
 * path when the file is empty.
 */
public class FileArtifactProbe implements ArtifactProbe {

    private static final Logger log = LoggerFactory.getLogger(FileArtifactProbe.class);

    private final Path workingDir;
    private final String pattern;

    public FileArtifactProbe(Path workingDir, String pattern) {
        this.workingDir = workingDir;
        this.pattern = pattern;
    }

    @Override
    public Optional<String> find(RunLevel level, WorkItem item) {
        if (level != RunLevel.EPIC || pattern == null || pattern.isBlank()) {
            return Optional.empty();
        }
        Path file = workingDir.resolve(pattern.replace("{id}", item.id()));
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            String first = Files.readAllLines(file).stream()
                    .map(String::strip)
                    .filter(line -> !line.isEmpty())
                    .findFirst()
                    .orElse(file.toString());
            return Optional.of(first);
        } catch (IOException e) {
            log.warn("Cannot read artifact {}: {}", file, e.getMessage());
            return Optional.of(file.toString());
        }
    }
}
