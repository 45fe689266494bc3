package com.armada.dispatch.cli;

import com.armada.core.model.ExecutionPlan;
import com.armada.core.model.ItemState;
import com.armada.core.model.RunState;
import com.armada.core.model.RunStatus;
import com.armada.core.plan.PlanStore;
import com.armada.core.state.RunStateStore;
import com.armada.core.state.StateStoreException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: armada status &lt;run-id&gt;
 * <p>
 * Reads the stored state of a run and displays status, waves, per-item progress and errors.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the stored state of a run")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "RUN_ID", description = "Run identifier, e.g. epic-151 or project-q3")
    String runId;

    private final RunStateStore stateStore;
    private final PlanStore planStore;

    public StatusCommand(RunStateStore stateStore, PlanStore planStore) {
        this.stateStore = stateStore;
        this.planStore = planStore;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Optional<RunState> found;
        try {
            found = stateStore.find(runId);
        } catch (StateStoreException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        if (found.isEmpty()) {
            ConsoleOutput.error("Run not found: " + runId);
            return 1;
        }
        RunState state = found.get();

        System.out.println();
        System.out.println("RUN " + state.runId() + " (" + state.level().prefix() + " level)");
        System.out.println("Started: " + state.createdAt() + "   Updated: " + state.updatedAt()
                + "   PID: " + state.pid() + "@" + state.hostname());
        RunStatus status = state.status();
        if (status == RunStatus.COMPLETED) {
            ConsoleOutput.success("Status: " + status.wireName());
        } else if (status == RunStatus.FATAL_ERROR) {
            ConsoleOutput.error("Status: " + status.wireName());
        } else {
            ConsoleOutput.info("Status: " + status.wireName());
        }
        ConsoleOutput.info("Current wave: " + state.currentWave() + " | Completed waves: " + state.completedWaves());

        Optional<ExecutionPlan> plan = Optional.empty();
        try {
            plan = planStore.find(runId);
        } catch (RuntimeException e) {
            ConsoleOutput.warn("Stored plan unreadable: " + e.getMessage());
        }
        plan.ifPresent(ConsoleOutput::plan);

        if (!state.items().isEmpty()) {
            System.out.println();
            System.out.printf("  %-12s %-12s %-9s %s%n", state.level().itemNoun().toUpperCase(), "STATUS", "ATTEMPTS", "MESSAGE");
            System.out.println("  " + "-".repeat(64));
            for (Map.Entry<String, ItemState> entry : state.items().entrySet()) {
                ItemState item = entry.getValue();
                System.out.printf("  %-12s %-12s %-9d %s%n", entry.getKey(), item.status().wireName(),
                        item.attempts(), truncate(item.message(), 40));
            }
        }

        if (!state.errors().isEmpty()) {
            System.out.println();
            ConsoleOutput.error("Errors (" + state.errors().size() + "):");
            for (var e : state.errors()) {
                ConsoleOutput.error("  " + e.timestamp() + " " + e.itemId() + " [" + e.kind().label() + "] "
                        + truncate(e.message(), 80));
            }
        }
        return 0;
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String flat = s.replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max - 3) + "...";
    }
}
