package com.armada.dispatch.cli;

import com.armada.core.config.ArmadaProperties;
import com.armada.core.engine.RunDriver;
import com.armada.core.events.EventBus;
import com.armada.core.model.RunLevel;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: armada epic &lt;number&gt;
 * <p>
 * Runs the issues of one epic wave by wave, one agent process per issue.
 */
@Command(name = "epic", mixinStandardHelpOptions = true, description = "Run the issues of an epic")
@Component
public class EpicCommand extends AbstractRunCommand {

    @Parameters(index = "0", paramLabel = "NUMBER", description = "Epic number")
    String epic;

    public EpicCommand(RunDriver driver, ArmadaProperties properties, EventBus eventBus) {
        super(driver, properties, eventBus);
    }

    @Override
    RunLevel level() {
        return RunLevel.EPIC;
    }

    @Override
    String target() {
        return epic;
    }

    @Override
    String validateTarget() {
        return epic.matches("\\d+") ? null : "Epic number must be numeric: " + epic;
    }
}
