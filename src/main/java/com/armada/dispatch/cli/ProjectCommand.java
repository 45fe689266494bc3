package com.armada.dispatch.cli;

import com.armada.core.config.ArmadaProperties;
import com.armada.core.engine.RunDriver;
import com.armada.core.events.EventBus;
import com.armada.core.model.RunLevel;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: armada project &lt;name&gt;
 * <p>
 * Runs the epics of a project wave by wave. Each epic is a nested run that resumes the epic's
 * stored state and plan.
 */
@Command(name = "project", mixinStandardHelpOptions = true, description = "Run the epics of a project")
@Component
public class ProjectCommand extends AbstractRunCommand {

    @Parameters(index = "0", paramLabel = "NAME", description = "Project name")
    String project;

    public ProjectCommand(RunDriver driver, ArmadaProperties properties, EventBus eventBus) {
        super(driver, properties, eventBus);
    }

    @Override
    RunLevel level() {
        return RunLevel.PROJECT;
    }

    @Override
    String target() {
        return project;
    }

    @Override
    String validateTarget() {
        return project.matches("[A-Za-z0-9._-]+") ? null
                : "Project name may only contain letters, digits, '.', '_' and '-': " + project;
    }
}
