package com.armada.core.config;

import com.armada.core.model.RunLevel;
import com.armada.core.scheduler.SchedulerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "armada")
public class ArmadaProperties {

    private String stateDir = ".armada";
    private int shutdownGraceSeconds = 600;
    private Backoff backoff = new Backoff();
    private Level epic = new Level(0, 2, 60);
    private Level project = new Level(2, 1, 120);
    private Agent agent = new Agent();

    public Path getStatePath() { return Path.of(stateDir); }

    public Level level(RunLevel level) {
        return level == RunLevel.EPIC ? epic : project;
    }

    /**
     * Scheduling limits for {@code level}, with any non-null override from the command line
     * taking precedence.
     */
    public SchedulerSettings settingsFor(RunLevel level, Integer jobs, Integer maxRetries, Integer timeoutMinutes) {
        Level base = level(level);
        return new SchedulerSettings(
                jobs != null ? jobs : base.maxParallel,
                maxRetries != null ? maxRetries : base.maxRetries,
                Duration.ofMinutes(timeoutMinutes != null ? timeoutMinutes : base.itemTimeoutMinutes));
    }

    public String getStateDir() { return stateDir; }
    public void setStateDir(String stateDir) { this.stateDir = stateDir; }
    public int getShutdownGraceSeconds() { return shutdownGraceSeconds; }
    public void setShutdownGraceSeconds(int shutdownGraceSeconds) { this.shutdownGraceSeconds = shutdownGraceSeconds; }
    public Backoff getBackoff() { return backoff; }
    public void setBackoff(Backoff backoff) { this.backoff = backoff; }
    public Level getEpic() { return epic; }
    public void setEpic(Level epic) { this.epic = epic; }
    public Level getProject() { return project; }
    public void setProject(Level project) { this.project = project; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }

    public static class Backoff {
        private int baseSeconds = 5;
        private int maxSeconds = 300;
        private double jitter = 0.2;

        public int getBaseSeconds() { return baseSeconds; }
        public void setBaseSeconds(int baseSeconds) { this.baseSeconds = baseSeconds; }
        public int getMaxSeconds() { return maxSeconds; }
        public void setMaxSeconds(int maxSeconds) { this.maxSeconds = maxSeconds; }
        public double getJitter() { return jitter; }
        public void setJitter(double jitter) { this.jitter = jitter; }
    }

    /** Per-level scheduling defaults. */
    public static class Level {
        private int maxParallel;
        private int maxRetries;
        private int itemTimeoutMinutes;

        public Level() {}

        Level(int maxParallel, int maxRetries, int itemTimeoutMinutes) {
            this.maxParallel = maxParallel;
            this.maxRetries = maxRetries;
            this.itemTimeoutMinutes = itemTimeoutMinutes;
        }

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public int getItemTimeoutMinutes() { return itemTimeoutMinutes; }
        public void setItemTimeoutMinutes(int itemTimeoutMinutes) { this.itemTimeoutMinutes = itemTimeoutMinutes; }
    }

    public static class Agent {
        private List<String> command = new ArrayList<>(List.of("scripts/swarm.sh", "{id}"));
        private String workingDir = ".";
        private String artifactPattern = ".worktrees/issue-{id}.pr";
        private int maxOutputChars = 10000;

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public String getWorkingDir() { return workingDir; }
        public void setWorkingDir(String workingDir) { this.workingDir = workingDir; }
        public String getArtifactPattern() { return artifactPattern; }
        public void setArtifactPattern(String artifactPattern) { this.artifactPattern = artifactPattern; }
        public int getMaxOutputChars() { return maxOutputChars; }
        public void setMaxOutputChars(int maxOutputChars) { this.maxOutputChars = maxOutputChars; }
    }
}
