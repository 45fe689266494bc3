package com.armada.dispatch.cli;

import com.armada.core.engine.RunOutcome;
import com.armada.core.events.ArmadaEvent;
import com.armada.core.model.ExecutionPlan;
import com.armada.core.model.RunState;
import com.armada.core.model.RunSummary;
import com.armada.core.model.Wave;
import com.armada.core.scheduler.WaveScheduler;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the armada CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ARMADA v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ARMADA]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /** Renders one progress event. Events of runs other than {@code topRunId} are prefixed with their run id. */
    public static void event(ArmadaEvent event, String topRunId) {
        Map<String, Object> p = event.payload();
        String prefix = event.runId().equals(topRunId) ? "" : "[" + event.runId() + "] ";
        switch (event.eventType()) {
            case "run.started" -> info(prefix + "Started: " + p.get("waves") + " wave(s), "
                    + p.get("items") + " item(s)");
            case "wave.started" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|bold,fg(yellow) " + prefix + "[WAVE " + p.get("wave") + "]|@ " + p.get("items")
                            + description(p.get("description"))));
            case "item.started" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(blue) >|@ " + prefix + event.itemId() + " " + p.get("title")));
            case "item.completed" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green) COMPLETED|@ " + prefix + event.itemId() + " " + p.get("message")));
            case "item.failed" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) FAILED|@ " + prefix + event.itemId() + " (" + p.get("kind")
                            + ", attempt " + p.get("attempts")
                            + (Boolean.TRUE.equals(p.get("willRetry")) ? ", will retry)" : ")")));
            case "item.fatal" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|bold,fg(red) FATAL|@ " + prefix + event.itemId() + " (" + p.get("kind") + ")"));
            case "item.interrupted" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) INTERRUPTED|@ " + prefix + event.itemId()));
            case "wave.retry" -> warn(prefix + "Wave " + p.get("wave") + ": retrying " + p.get("items")
                    + " in " + p.get("delaySeconds") + "s");
            case "wave.completed" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(yellow) " + prefix + "[WAVE " + p.get("wave") + " COMPLETE]|@ "
                            + p.get("completed") + "/" + p.get("total") + " completed"));
            case "run.completed" -> success(prefix + "Run complete: " + p.get("completed") + "/" + p.get("total"));
            case "run.interrupted" -> warn(prefix + "Run interrupted, resume with --resume");
            case "run.fatal" -> error(prefix + "Run halted on fatal error");
            default -> {
                // not rendered
            }
        }
    }

    public static void plan(ExecutionPlan plan) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Execution plan|@"));
        System.out.println("  Items: " + plan.totalItems() + " in " + plan.waves().size() + " wave(s)");
        for (Wave wave : plan.waves()) {
            System.out.println("  Wave " + wave.number() + ": " + String.join(", ", wave.itemIds()));
            if (wave.description() != null && !wave.description().isBlank()) {
                System.out.println("    └─ " + wave.description());
            }
        }
        System.out.println("  Estimated time: "
                + (plan.estimatedTime() == null || plan.estimatedTime().isBlank() ? "unknown" : plan.estimatedTime()));
    }

    public static void dryRun(RunOutcome outcome, int maxRetries) {
        plan(outcome.plan());
        RunState state = outcome.state();
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Would dispatch|@"
                + (state != null ? " (existing state: " + state.status().wireName() + ")" : "")));
        for (Wave wave : outcome.plan().waves()) {
            List<String> items = state != null
                    ? WaveScheduler.eligibleItems(state, wave, maxRetries)
                    : wave.itemIds();
            if (state != null && state.waveCompleted(wave.number()) && items.isEmpty()) {
                System.out.println("  Wave " + wave.number() + ": already completed");
                continue;
            }
            System.out.println("  Wave " + wave.number() + ": " + (items.isEmpty() ? "nothing" : String.join(", ", items)));
        }
        System.out.println();
        info("[DRY RUN] No lock taken, nothing written");
    }

    public static void outcome(RunOutcome outcome) {
        RunSummary s = outcome.summary();
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run " + outcome.runId() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Items: @|fg(green) " + s.completed() + " completed|@, @|fg(red) " + s.failed()
                        + " failed|@, " + s.fatal() + " fatal, " + s.pending() + " pending (" + s.total() + " total)"));
        if (outcome.report() != null) {
            System.out.println("  Report: " + outcome.report());
        }
        switch (outcome.exitCode()) {
            case RunOutcome.EXIT_SUCCESS -> success("Status: " + outcome.status().wireName());
            case RunOutcome.EXIT_PARTIAL -> warn("Status: " + outcome.status().wireName() + " with failed items");
            case RunOutcome.EXIT_INTERRUPTED -> warn("Status: " + outcome.status().wireName()
                    + ". Resume with --resume");
            default -> {
                error("Status: " + outcome.status().wireName());
                outcome.state().errors().stream()
                        .filter(e -> e.kind().isFatal())
                        .forEach(e -> error("  " + e.itemId() + " [" + e.kind().label() + "] " + e.message()));
            }
        }
    }

    private static String description(Object description) {
        return description == null || description.toString().isBlank() ? "" : " - " + description;
    }
}
