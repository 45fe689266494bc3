package com.armada.dispatch.cli;

import com.armada.core.config.ArmadaProperties;
import com.armada.core.engine.RunDriver;
import com.armada.core.engine.RunOutcome;
import com.armada.core.engine.RunRequest;
import com.armada.core.events.EventBus;
import com.armada.core.lock.LockException;
import com.armada.core.lock.LockHeldException;
import com.armada.core.model.RunLevel;
import com.armada.core.plan.InvalidPlanException;
import com.armada.core.state.RunStateAlreadyExistsException;
import com.armada.core.state.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * Shared body of {@code epic} and {@code project}: builds the request, streams progress events
 * to the console, and maps the outcome to the process exit code.
 */
abstract class AbstractRunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractRunCommand.class);

    @Mixin
    RunOptions options = new RunOptions();

    private final RunDriver driver;
    private final ArmadaProperties properties;
    private final EventBus eventBus;

    AbstractRunCommand(RunDriver driver, ArmadaProperties properties, EventBus eventBus) {
        this.driver = driver;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    abstract RunLevel level();

    abstract String target();

    /** @return a problem with the target, or null */
    String validateTarget() {
        return null;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        String problem = options.validate();
        if (problem == null) {
            problem = validateTarget();
        }
        if (problem != null) {
            ConsoleOutput.error(problem);
            return RunOutcome.EXIT_FATAL;
        }

        RunRequest request = new RunRequest(level(), target(), options.plan, options.resume, options.fresh,
                options.force, options.dryRun,
                properties.settingsFor(level(), options.jobs, options.maxRetries, options.timeoutMinutes));
        ConsoleOutput.info("Run " + request.runId() + " (state in " + properties.getStatePath() + ")");

        EventBus.Subscription subscription = eventBus.subscribe(e -> ConsoleOutput.event(e, request.runId()));
        try {
            RunOutcome outcome = driver.execute(request);
            if (outcome.dryRun()) {
                ConsoleOutput.dryRun(outcome, request.settings().maxRetries());
            } else {
                ConsoleOutput.outcome(outcome);
            }
            return outcome.exitCode();
        } catch (InvalidPlanException e) {
            ConsoleOutput.error(e.getMessage());
            return RunOutcome.EXIT_FATAL;
        } catch (LockHeldException | RunStateAlreadyExistsException e) {
            ConsoleOutput.error(e.getMessage());
            return RunOutcome.EXIT_FATAL;
        } catch (LockException | StateStoreException e) {
            log.error("Run {} aborted", request.runId(), e);
            ConsoleOutput.error(e.getMessage());
            return RunOutcome.EXIT_FATAL;
        } finally {
            subscription.unsubscribe();
        }
    }
}
