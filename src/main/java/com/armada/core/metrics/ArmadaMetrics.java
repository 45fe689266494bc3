package com.armada.core.metrics;

import com.armada.core.model.ErrorKind;
import com.armada.core.model.ItemStatus;
import com.armada.core.model.RunLevel;
import com.armada.core.model.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for armada run execution.
 */
public class ArmadaMetrics {

    private final MeterRegistry registry;

    public ArmadaMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordItemExecution(RunLevel level, Duration elapsed) {
        Timer.builder("armada.item.duration")
                .tag("level", level.prefix())
                .register(registry)
                .record(elapsed);
    }

    public void recordItemOutcome(RunLevel level, ItemStatus status) {
        Counter.builder("armada.item.outcomes")
                .tag("level", level.prefix())
                .tag("status", status.wireName())
                .register(registry)
                .increment();
    }

    /**
     * Records a failure that will be retried in a later pass of the same wave.
     *
     * @param kind classified error kind of the failure
     */
    public void recordRetry(ErrorKind kind) {
        Counter.builder("armada.retries")
                .description("Failed items scheduled for another attempt")
                .tag("kind", kind.label())
                .register(registry)
                .increment();
    }

    public void recordWaveExecution(int itemCount) {
        DistributionSummary.builder("armada.wave.item_count")
                .description("Items dispatched per wave pass")
                .register(registry)
                .record(itemCount);
    }

    public void recordRunResult(RunLevel level, RunStatus status) {
        Counter.builder("armada.runs.total")
                .tag("level", level.prefix())
                .tag("status", status.wireName())
                .register(registry)
                .increment();
    }
}
