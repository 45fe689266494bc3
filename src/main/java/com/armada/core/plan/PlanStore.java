package com.armada.core.plan;

import com.armada.core.model.ExecutionPlan;
import com.armada.core.state.RunStateStore;
import com.armada.core.state.StateStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * Keeps the accepted plan of each run next to its state, as {@code <runId>-plan.json}.
 */
public class PlanStore {

    private static final Logger log = LoggerFactory.getLogger(PlanStore.class);

    private final Path stateDir;
    private final ObjectMapper mapper;
    private final PlanLoader loader;

    public PlanStore(Path stateDir, ObjectMapper mapper, PlanLoader loader) {
        this.stateDir = stateDir;
        this.mapper = mapper;
        this.loader = loader;
    }

    public Path planFile(String runId) {
        return stateDir.resolve(runId + "-plan.json");
    }

    public boolean exists(String runId) {
        return Files.isRegularFile(planFile(runId));
    }

    public void save(String runId, ExecutionPlan plan) {
        try {
            byte[] bytes = mapper.writeValueAsBytes(PlanLoader.toDocument(plan, mapper));
            Path file = planFile(runId);
            if (Files.isRegularFile(file) && Arrays.equals(Files.readAllBytes(file), bytes)) {
                return;
            }
            RunStateStore.atomicWrite(file, bytes);
            log.info("Stored plan for run {} at {}", runId, file);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Cannot serialize plan of run " + runId, e);
        } catch (IOException e) {
            throw new StateStoreException("Cannot read stored plan of run " + runId, e);
        }
    }

    /**
     * @throws InvalidPlanException if the stored plan no longer validates
     */
    public Optional<ExecutionPlan> find(String runId) {
        if (!exists(runId)) {
            return Optional.empty();
        }
        return Optional.of(loader.load(planFile(runId)));
    }
}
