package com.wayfarer.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "wayfarer")
public class WorkflowProperties {

    private Workflow workflow = new Workflow();
    private Snapshots snapshots = new Snapshots();

    // -- Workflow accessors (delegate to nested) --
    public int getMaxConcurrency() { return workflow.maxConcurrency; }
    public int getMaxAttempts() { return workflow.maxAttempts; }
    public int getMinSuccessfulTasks() { return workflow.minSuccessfulTasks; }
    public double getConfidenceThreshold() { return workflow.confidenceThreshold; }
    public int getMaxSteps() { return workflow.maxSteps; }

    /**
     * Default deadline for a single capability call, or null when calls are unbounded
     * ({@code task-timeout-seconds} of 0 or less).
     */
    public Duration getTaskTimeout() {
        return workflow.taskTimeoutSeconds > 0 ? Duration.ofSeconds(workflow.taskTimeoutSeconds) : null;
    }

    /**
     * Deadline for a whole parallel batch, or null when batches are bounded only by
     * their per-task timeouts.
     */
    public Duration getBatchTimeout() {
        return workflow.batchTimeoutSeconds > 0 ? Duration.ofSeconds(workflow.batchTimeoutSeconds) : null;
    }

    // -- Snapshot accessors --
    public String getSnapshotStore() { return snapshots.store; }
    public String getSnapshotDirectory() { return snapshots.directory; }

    public Workflow getWorkflow() { return workflow; }
    public void setWorkflow(Workflow workflow) { this.workflow = workflow; }
    public Snapshots getSnapshots() { return snapshots; }
    public void setSnapshots(Snapshots snapshots) { this.snapshots = snapshots; }

    public static class Workflow {
        private int maxConcurrency = 3;
        private int taskTimeoutSeconds = 60;
        private int batchTimeoutSeconds = 0;
        private int maxAttempts = 3;
        private int minSuccessfulTasks = 1;
        private double confidenceThreshold = 0.6;
        private int maxSteps = 100;

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
        public int getTaskTimeoutSeconds() { return taskTimeoutSeconds; }
        public void setTaskTimeoutSeconds(int taskTimeoutSeconds) { this.taskTimeoutSeconds = taskTimeoutSeconds; }
        public int getBatchTimeoutSeconds() { return batchTimeoutSeconds; }
        public void setBatchTimeoutSeconds(int batchTimeoutSeconds) { this.batchTimeoutSeconds = batchTimeoutSeconds; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public int getMinSuccessfulTasks() { return minSuccessfulTasks; }
        public void setMinSuccessfulTasks(int minSuccessfulTasks) { this.minSuccessfulTasks = minSuccessfulTasks; }
        public double getConfidenceThreshold() { return confidenceThreshold; }
        public void setConfidenceThreshold(double confidenceThreshold) { this.confidenceThreshold = confidenceThreshold; }
        public int getMaxSteps() { return maxSteps; }
        public void setMaxSteps(int maxSteps) { this.maxSteps = maxSteps; }
    }

    public static class Snapshots {
        private String store = "file";
        private String directory = System.getProperty("user.home") + "/.wayfarer/runs";

        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }
}
