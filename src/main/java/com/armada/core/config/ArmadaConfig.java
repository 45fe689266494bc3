package com.armada.core.config;

import com.armada.agent.AgentCommandWork;
import com.armada.agent.ChildProcessRegistry;
import com.armada.agent.FileArtifactProbe;
import com.armada.core.classify.ErrorClassifier;
import com.armada.core.engine.EpicRunWork;
import com.armada.core.engine.ReportWriter;
import com.armada.core.engine.RunDriver;
import com.armada.core.engine.ShutdownSignal;
import com.armada.core.engine.WorkFactory;
import com.armada.core.events.EventBus;
import com.armada.core.executor.BoundedExecutor;
import com.armada.core.lock.HostProcessProbe;
import com.armada.core.lock.LockManager;
import com.armada.core.metrics.ArmadaMetrics;
import com.armada.core.model.RunLevel;
import com.armada.core.plan.PlanLoader;
import com.armada.core.plan.PlanStore;
import com.armada.core.scheduler.ArtifactProbe;
import com.armada.core.scheduler.BackoffPolicy;
import com.armada.core.scheduler.WaveScheduler;
import com.armada.core.state.RunStateStore;
import com.armada.core.state.StateJson;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(ArmadaProperties.class)
public class ArmadaConfig {

    @Bean
    public ObjectMapper armadaObjectMapper() {
        return StateJson.newObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    public ArmadaMetrics armadaMetrics(MeterRegistry registry) {
        return new ArmadaMetrics(registry);
    }

    @Bean
    public ShutdownSignal shutdownSignal() {
        return new ShutdownSignal();
    }

    @Bean
    public ChildProcessRegistry childProcessRegistry() {
        return new ChildProcessRegistry();
    }

    @Bean
    public RunStateStore runStateStore(ArmadaProperties properties, ObjectMapper mapper) {
        return new RunStateStore(properties.getStatePath(), mapper);
    }

    @Bean
    public PlanLoader planLoader(ObjectMapper mapper) {
        return new PlanLoader(mapper);
    }

    @Bean
    public PlanStore planStore(ArmadaProperties properties, ObjectMapper mapper, PlanLoader loader) {
        return new PlanStore(properties.getStatePath(), mapper, loader);
    }

    @Bean
    public LockManager lockManager(ArmadaProperties properties, ObjectMapper mapper) {
        return new LockManager(properties.getStatePath(), mapper, new HostProcessProbe());
    }

    @Bean
    public ArtifactProbe artifactProbe(ArmadaProperties properties) {
        return new FileArtifactProbe(Path.of(properties.getAgent().getWorkingDir()),
                properties.getAgent().getArtifactPattern());
    }

    @Bean
    public BackoffPolicy backoffPolicy(ArmadaProperties properties) {
        var backoff = properties.getBackoff();
        return new BackoffPolicy(Duration.ofSeconds(backoff.getBaseSeconds()),
                Duration.ofSeconds(backoff.getMaxSeconds()), backoff.getJitter());
    }

    @Bean
    public WaveScheduler waveScheduler(RunStateStore store, BackoffPolicy backoff, ArtifactProbe artifacts,
                                       EventBus eventBus, ArmadaMetrics metrics, Clock clock) {
        return new WaveScheduler(store, new BoundedExecutor("armada"), new ErrorClassifier(), backoff,
                artifacts, eventBus, metrics, clock);
    }

    @Bean
    public ReportWriter reportWriter(ArmadaProperties properties, ArtifactProbe artifacts, Clock clock) {
        return new ReportWriter(properties.getStatePath(), artifacts, clock);
    }

    /**
     * Issues run as agent processes; epics run as nested in-process drivers using the epic-level
     * defaults.
     */
    @Bean
    public WorkFactory workFactory(ArmadaProperties properties, RunStateStore stateStore,
                                   ChildProcessRegistry registry) {
        return (request, driver) -> {
            if (request.level() == RunLevel.PROJECT) {
                return new EpicRunWork(driver, stateStore, properties.settingsFor(RunLevel.EPIC, null, null, null));
            }
            var agent = properties.getAgent();
            Path logDir = properties.getStatePath().resolve("logs").resolve(request.runId());
            return new AgentCommandWork(agent.getCommand(), Path.of(agent.getWorkingDir()), logDir,
                    request.runId(), agent.getMaxOutputChars(), registry);
        };
    }

    @Bean
    public RunDriver runDriver(RunStateStore stateStore, PlanStore planStore, PlanLoader planLoader,
                               LockManager lockManager, WaveScheduler scheduler, ReportWriter reportWriter,
                               WorkFactory workFactory, ShutdownSignal shutdownSignal, EventBus eventBus,
                               ArmadaMetrics metrics) {
        return new RunDriver(stateStore, planStore, planLoader, lockManager, scheduler, reportWriter,
                workFactory, shutdownSignal, eventBus, metrics);
    }
}
