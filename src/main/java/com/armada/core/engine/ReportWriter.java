package com.armada.core.engine;

import com.armada.core.model.ErrorRecord;
import com.armada.core.model.ExecutionPlan;
import com.armada.core.model.ItemState;
import com.armada.core.model.ItemStatus;
import com.armada.core.model.RunState;
import com.armada.core.model.RunSummary;
import com.armada.core.model.Wave;
import com.armada.core.model.WorkItem;
import com.armada.core.scheduler.ArtifactProbe;
import com.armada.core.state.RunStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Writes a markdown report ({@code <runId>-report.md}) once all waves are done.
 * Everything in it is derived from the run state and the plan.
 */
public class ReportWriter implements RunFinalizer {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final Path stateDir;
    private final ArtifactProbe artifacts;
    private final Clock clock;

    public ReportWriter(Path stateDir, ArtifactProbe artifacts, Clock clock) {
        this.stateDir = stateDir;
        this.artifacts = artifacts;
        this.clock = clock;
    }

    public Path reportFile(String runId) {
        return stateDir.resolve(runId + "-report.md");
    }

    @Override
    public Optional<Path> finalizeRun(RunState state, ExecutionPlan plan) {
        Path file = reportFile(state.runId());
        RunStateStore.atomicWrite(file, render(state, plan).getBytes(StandardCharsets.UTF_8));
        log.info("Wrote report for run {} to {}", state.runId(), file);
        return Optional.of(file);
    }

    public String render(RunState state, ExecutionPlan plan) {
        RunSummary summary = RunSummary.of(state, plan);
        String noun = state.level().itemNoun();
        var sb = new StringBuilder();
        sb.append("# Run report: ").append(state.runId()).append("\n\n");
        sb.append("- Generated: ").append(clock.instant().truncatedTo(ChronoUnit.SECONDS)).append('\n');
        sb.append("- Started: ").append(state.createdAt()).append('\n');
        sb.append("- ").append(capitalize(noun)).append("s: ")
                .append(summary.completed()).append(" completed, ")
                .append(summary.failed()).append(" failed, ")
                .append(summary.fatal()).append(" fatal, ")
                .append(summary.pending()).append(" pending (")
                .append(summary.total()).append(" total)\n");
        if (plan.estimatedTime() != null && !plan.estimatedTime().isBlank()) {
            sb.append("- Estimated time: ").append(plan.estimatedTime()).append('\n');
        }

        for (Wave wave : plan.waves()) {
            sb.append("\n## Wave ").append(wave.number());
            if (wave.description() != null && !wave.description().isBlank()) {
                sb.append(": ").append(wave.description());
            }
            sb.append("\n\n| ").append(capitalize(noun)).append(" | Title | Status | Attempts | Result |\n");
            sb.append("|---|---|---|---|---|\n");
            for (WorkItem item : plan.itemsOf(wave)) {
                ItemState itemState = state.item(item.id());
                String result = itemState.status() == ItemStatus.COMPLETED
                        ? artifacts.find(state.level(), item).orElse(itemState.message())
                        : itemState.message();
                sb.append("| ").append(item.id())
                        .append(" | ").append(cell(item.title()))
                        .append(" | ").append(itemState.status().wireName())
                        .append(" | ").append(itemState.attempts())
                        .append(" | ").append(cell(result))
                        .append(" |\n");
            }
        }

        if (!state.errors().isEmpty()) {
            sb.append("\n## Errors\n\n");
            for (ErrorRecord error : state.errors()) {
                sb.append("- ").append(error.timestamp()).append(' ')
                        .append(noun).append(' ').append(error.itemId())
                        .append(" [").append(error.kind().label()).append("] ")
                        .append(cell(error.message())).append('\n');
            }
        }

        if (!plan.successCriteria().isEmpty()) {
            sb.append("\n## Success criteria\n\n");
            String box = summary.allCompleted() ? "[x]" : "[ ]";
            for (String criterion : plan.successCriteria()) {
                sb.append("- ").append(box).append(' ').append(criterion).append('\n');
            }
        }
        return sb.toString();
    }

    private static String cell(String text) {
        if (text == null) {
            return "";
        }
        String flat = text.replace('\n', ' ').replace("|", "\\|").strip();
        return flat.length() > 200 ? flat.substring(0, 200) + "..." : flat;
    }

    private static String capitalize(String word) {
        return word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}
