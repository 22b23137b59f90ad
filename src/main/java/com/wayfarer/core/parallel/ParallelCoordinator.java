package com.wayfarer.core.parallel;

import com.wayfarer.core.capability.Outcome;
import com.wayfarer.core.config.WorkflowProperties;
import com.wayfarer.core.events.EventBus;
import com.wayfarer.core.events.EventType;
import com.wayfarer.core.events.WayfarerEvent;
import com.wayfarer.core.logging.MdcContext;
import com.wayfarer.core.metrics.WayfarerMetrics;
import com.wayfarer.core.model.TaskKind;
import com.wayfarer.core.model.TaskOutcome;
import com.wayfarer.core.model.TaskPayload;
import com.wayfarer.core.model.TaskSpec;
import com.wayfarer.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a batch of independent tasks concurrently and returns one outcome per task.
 * <p>
 * Every task receives the same immutable {@link PlanningState} snapshot. A task that
 * throws, returns nothing, or overruns its deadline becomes a {@link TaskOutcome.Failure};
 * it never cancels or delays its siblings. The call returns once every task has either
 * finished or been concluded as {@code "timeout"}. The pool is owned by the call and
 * shut down (with interruption) before returning, so hung tasks do not outlive the batch.
 * <p>
 * No retries happen here; whole-stage replay is the job of error recovery.
 */
@Component
public class ParallelCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ParallelCoordinator.class);
    static final String TIMEOUT = "timeout";

    private final int defaultConcurrency;
    private final Duration taskTimeout;
    private final Duration batchTimeout;
    private final EventBus eventBus;
    private final WayfarerMetrics metrics;

    @Autowired
    public ParallelCoordinator(WorkflowProperties properties, EventBus eventBus, WayfarerMetrics metrics) {
        this(properties.getMaxConcurrency(), properties.getTaskTimeout(), properties.getBatchTimeout(),
                eventBus, metrics);
    }

    ParallelCoordinator(int defaultConcurrency, Duration taskTimeout, Duration batchTimeout) {
        this(defaultConcurrency, taskTimeout, batchTimeout, new EventBus(), null);
    }

    ParallelCoordinator(int defaultConcurrency, Duration taskTimeout, Duration batchTimeout,
                        EventBus eventBus, WayfarerMetrics metrics) {
        if (defaultConcurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + defaultConcurrency);
        }
        this.defaultConcurrency = defaultConcurrency;
        this.taskTimeout = taskTimeout;
        this.batchTimeout = batchTimeout;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Executes {@code tasks} concurrently against {@code snapshot}.
     *
     * @return outcomes keyed by kind, exactly one per submitted task
     * @throws IllegalArgumentException if the batch is empty or names a kind twice
     */
    public Map<TaskKind, TaskOutcome> execute(Collection<TaskSpec> tasks, PlanningState snapshot) {
        validate(tasks);
        Objects.requireNonNull(snapshot, "snapshot");

        int parallelism = Math.min(tasks.size(),
                snapshot.concurrencyLimit() > 0 ? snapshot.concurrencyLimit() : defaultConcurrency);
        String runId = snapshot.runId();
        Instant batchStart = Instant.now();
        Instant batchDeadline = batchTimeout != null ? batchStart.plus(batchTimeout) : null;

        log.info("Executing {} task(s) with parallelism {}: {}", tasks.size(), parallelism,
                tasks.stream().map(t -> t.kind().label()).toList());
        if (metrics != null) {
            metrics.recordBatchSize(tasks.size());
        }

        ExecutorService executor = Executors.newFixedThreadPool(parallelism, threadFactory(runId));
        var futures = new EnumMap<TaskKind, CompletableFuture<TaskOutcome>>(TaskKind.class);
        try {
            for (TaskSpec spec : tasks) {
                Instant deadline = deadlineFor(spec, batchStart, batchDeadline);
                CompletableFuture<TaskOutcome> future = CompletableFuture
                        .supplyAsync(() -> runIsolated(spec, snapshot, deadline), executor);
                if (deadline != null) {
                    long remainingMs = Math.max(0, Duration.between(Instant.now(), deadline).toMillis());
                    future = future.completeOnTimeout(
                            TaskOutcome.failure(spec.kind(), TIMEOUT), remainingMs, TimeUnit.MILLISECONDS);
                }
                futures.put(spec.kind(), future);
            }

            var outcomes = new EnumMap<TaskKind, TaskOutcome>(TaskKind.class);
            for (var entry : futures.entrySet()) {
                outcomes.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
            }
            long failed = outcomes.values().stream().filter(o -> !o.succeeded()).count();
            log.info("Batch finished in {}ms: {} succeeded, {} failed",
                    Duration.between(batchStart, Instant.now()).toMillis(), outcomes.size() - failed, failed);
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private void validate(Collection<TaskSpec> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            throw new IllegalArgumentException("Task batch must not be empty");
        }
        var seen = EnumSet.noneOf(TaskKind.class);
        for (TaskSpec spec : tasks) {
            if (spec == null) {
                throw new IllegalArgumentException("Task batch contains a null task");
            }
            if (!seen.add(spec.kind())) {
                throw new IllegalArgumentException("Task batch contains " + spec.kind() + " more than once");
            }
        }
    }

    private Instant deadlineFor(TaskSpec spec, Instant batchStart, Instant batchDeadline) {
        Duration timeout = spec.timeout() != null ? spec.timeout() : taskTimeout;
        Instant taskDeadline = timeout != null ? batchStart.plus(timeout) : null;
        if (taskDeadline == null) return batchDeadline;
        if (batchDeadline == null) return taskDeadline;
        return taskDeadline.isBefore(batchDeadline) ? taskDeadline : batchDeadline;
    }

    /**
     * Runs one task, converting anything that escapes the capability into a failure.
     */
    private TaskOutcome runIsolated(TaskSpec spec, PlanningState snapshot, Instant deadline) {
        TaskKind kind = spec.kind();
        MdcContext.setTask(snapshot.runId(), kind.label());
        long startMs = System.currentTimeMillis();
        eventBus.publish(WayfarerEvent.of(EventType.TASK_STARTED, snapshot.runId(), kind.label(),
                Map.of("parameters", spec.parameters())));
        TaskOutcome outcome;
        try {
            Outcome<? extends TaskPayload> result = spec.capability().execute(spec.parameters(), snapshot, deadline);
            outcome = toTaskOutcome(kind, result);
        } catch (Exception e) {
            log.error("Task {} raised {}: {}", kind.label(), e.getClass().getSimpleName(), e.getMessage());
            outcome = TaskOutcome.failure(kind, describe(e));
        } finally {
            MdcContext.clearTask();
        }
        long elapsedMs = System.currentTimeMillis() - startMs;
        if (metrics != null) {
            metrics.recordTaskOutcome(kind.label(), outcome.succeeded(), elapsedMs);
        }
        publishResult(snapshot.runId(), outcome, elapsedMs);
        return outcome;
    }

    private TaskOutcome toTaskOutcome(TaskKind kind, Outcome<? extends TaskPayload> result) {
        if (result == null) {
            return TaskOutcome.failure(kind, "capability returned no outcome");
        }
        if (result instanceof Outcome.Failure<? extends TaskPayload> f) {
            return TaskOutcome.failure(kind, f.reason());
        }
        Object payload = ((Outcome.Success<? extends TaskPayload>) result).payload();
        if (!kind.accepts(payload)) {
            return TaskOutcome.failure(kind, "unexpected payload "
                    + (payload == null ? "null" : payload.getClass().getSimpleName()));
        }
        return TaskOutcome.success((TaskPayload) payload);
    }

    private TaskOutcome await(TaskKind kind, CompletableFuture<TaskOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskOutcome.failure(kind, "interrupted");
        } catch (ExecutionException e) {
            log.error("Unexpected error collecting outcome for {}", kind.label(), e.getCause());
            return TaskOutcome.failure(kind, describe(e.getCause()));
        }
    }

    private void publishResult(String runId, TaskOutcome outcome, long elapsedMs) {
        var payload = new HashMap<String, Object>();
        payload.put("elapsedMs", elapsedMs);
        if (outcome instanceof TaskOutcome.Failure f) {
            payload.put("reason", f.reason());
        }
        eventBus.publish(WayfarerEvent.of(outcome.succeeded() ? EventType.TASK_COMPLETED : EventType.TASK_FAILED,
                runId, outcome.kind().label(), payload));
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown error";
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static ThreadFactory threadFactory(String runId) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "task-" + (runId != null ? runId : "run") + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
