package com.wayfarer.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for planning runs.
 */
@Service
public class WayfarerMetrics {

    private final MeterRegistry registry;

    public WayfarerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageDuration(String stage, long ms) {
        Timer.builder("wayfarer.stage.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records one parallel task outcome and how long it took.
     *
     * @param kind    task kind label
     * @param success whether the task produced a payload
     * @param ms      elapsed time
     */
    public void recordTaskOutcome(String kind, boolean success, long ms) {
        Counter.builder("wayfarer.task.outcomes")
                .tag("kind", kind)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
        Timer.builder("wayfarer.task.duration")
                .tag("kind", kind)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordBatchSize(int size) {
        DistributionSummary.builder("wayfarer.batch.size")
                .description("Number of tasks per parallel batch")
                .register(registry)
                .record(size);
    }

    /**
     * @param stage       the failing stage
     * @param recoverable whether recovery resumed the run or terminated it
     */
    public void recordRecovery(String stage, boolean recoverable) {
        Counter.builder("wayfarer.recovery.decisions")
                .tag("stage", stage)
                .tag("decision", recoverable ? "retry" : "terminate")
                .register(registry)
                .increment();
    }

    public void recordInterruption(String resumeStage) {
        Counter.builder("wayfarer.interruptions.total")
                .tag("resumeStage", resumeStage)
                .register(registry)
                .increment();
    }

    public void recordRunResult(String status) {
        Counter.builder("wayfarer.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
