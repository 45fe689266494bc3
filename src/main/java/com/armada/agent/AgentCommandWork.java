package com.armada.agent;

import com.armada.core.executor.UnitOfWork;
import com.armada.core.executor.WorkResult;
import com.armada.core.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Epic-level unit of work: launches the configured agent command for one issue.
 *
 * <p>The command is a template whose arguments may contain {@code {id}} and {@code {runId}}.
 * Combined stdout and stderr go to {@code <logDir>/item-<id>.log}; the head and tail of that
 * log, up to {@code maxOutputChars}, become the output used for classification. Interrupting
 * the calling thread terminates the agent and its children.
 */
public class AgentCommandWork implements UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(AgentCommandWork.class);

    private final List<String> commandTemplate;
    private final Path workingDir;
    private final Path logDir;
    private final String runId;
    private final int maxOutputChars;
    private final ChildProcessRegistry registry;

    public AgentCommandWork(List<String> commandTemplate, Path workingDir, Path logDir, String runId,
                            int maxOutputChars, ChildProcessRegistry registry) {
        if (commandTemplate == null || commandTemplate.isEmpty()) {
            throw new IllegalArgumentException("agent command must not be empty");
        }
        this.commandTemplate = List.copyOf(commandTemplate);
        this.workingDir = workingDir;
        this.logDir = logDir;
        this.runId = runId;
        this.maxOutputChars = maxOutputChars;
        this.registry = registry;
    }

    @Override
    public WorkResult execute(WorkItem item) throws IOException, InterruptedException {
        List<String> command = commandFor(item);
        Files.createDirectories(logDir);
        Path logFile = logFile(item);

        log.info("Launching agent for {}: {}", item.id(), String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .directory(workingDir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(logFile.toFile())
                .start();
        registry.register(process);
        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            log.warn("Agent for {} interrupted, terminating PID {}", item.id(), process.pid());
            registry.destroyTree(process);
            throw e;
        } finally {
            registry.unregister(process);
        }

        String output = truncate(readLog(logFile), maxOutputChars);
        if (exitCode != 0) {
            log.warn("Agent for {} exited with code {}", item.id(), exitCode);
            return WorkResult.failure(output, exitCode);
        }
        return WorkResult.success(output);
    }

    List<String> commandFor(WorkItem item) {
        return commandTemplate.stream()
                .map(arg -> arg.replace("{id}", item.id()).replace("{runId}", runId))
                .toList();
    }

    Path logFile(WorkItem item) {
        return logDir.resolve("item-" + item.id() + ".log");
    }

    private static String readLog(Path logFile) throws IOException {
        if (!Files.isRegularFile(logFile)) {
            return "";
        }
        return new String(Files.readAllBytes(logFile), StandardCharsets.UTF_8);
    }

    /** Keeps the first and last halves of {@code text} when it exceeds {@code max} characters. */
    static String truncate(String text, int max) {
        if (max <= 0 || text.length() <= max) {
            return text;
        }
        int half = max / 2;
        int omitted = text.length() - 2 * half;
        return text.substring(0, half)
                + "\n... [" + omitted + " characters omitted] ...\n"
                + text.substring(text.length() - half);
    }
}
