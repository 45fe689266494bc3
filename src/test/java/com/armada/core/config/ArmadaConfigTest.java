package com.armada.core.config;

import com.armada.agent.AgentCommandWork;
import com.armada.core.engine.EpicRunWork;
import com.armada.core.engine.RunDriver;
import com.armada.core.engine.RunRequest;
import com.armada.core.engine.WorkFactory;
import com.armada.core.model.RunLevel;
import com.armada.core.scheduler.SchedulerSettings;
import com.armada.core.state.RunStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wiring of the armada beans without the CLI.
 */
class ArmadaConfigTest {

    @TempDir
    Path tempDir;

    private ApplicationContextRunner runner() {
        return new ApplicationContextRunner()
                .withUserConfiguration(ArmadaConfig.class)
                .withPropertyValues("armada.state-dir=" + tempDir);
    }

    @Test
    void wiresTheDriverAgainstTheConfiguredStateDir() {
        runner().run(context -> {
            assertNotNull(context.getBean(RunDriver.class));
            assertNotNull(context.getBean(MeterRegistry.class));
            RunStateStore store = context.getBean(RunStateStore.class);
            assertEquals(tempDir.resolve("epic-151.json"), store.stateFile("epic-151"));
        });
    }

    @Test
    void workFactoryNestsEpicsAndLaunchesAgentsForIssues() {
        runner().run(context -> {
            WorkFactory factory = context.getBean(WorkFactory.class);
            RunDriver driver = context.getBean(RunDriver.class);
            var settings = new SchedulerSettings(1, 1, Duration.ZERO);

            var project = new RunRequest(RunLevel.PROJECT, "q3", null, false, false, false, false, settings);
            var epic = new RunRequest(RunLevel.EPIC, "151", null, false, false, false, false, settings);

            assertInstanceOf(EpicRunWork.class, factory.create(project, driver));
            assertInstanceOf(AgentCommandWork.class, factory.create(epic, driver));
        });
    }
}
