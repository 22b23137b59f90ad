package com.wayfarer.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowPropertiesTest {

    @Test
    @DisplayName("defaults match the documented workflow settings")
    void defaults() {
        WorkflowProperties properties = new WorkflowProperties();

        assertEquals(3, properties.getMaxConcurrency());
        assertEquals(3, properties.getMaxAttempts());
        assertEquals(1, properties.getMinSuccessfulTasks());
        assertEquals(0.6, properties.getConfidenceThreshold());
        assertEquals(Duration.ofSeconds(60), properties.getTaskTimeout());
        assertNull(properties.getBatchTimeout());
        assertEquals("file", properties.getSnapshotStore());
    }

    @Nested
    @DisplayName("timeouts")
    class Timeouts {

        @Test
        @DisplayName("a task timeout of zero means no deadline")
        void zeroTaskTimeout() {
            WorkflowProperties properties = new WorkflowProperties();
            properties.getWorkflow().setTaskTimeoutSeconds(0);

            assertNull(properties.getTaskTimeout());
        }

        @Test
        @DisplayName("a negative task timeout means no deadline")
        void negativeTaskTimeout() {
            WorkflowProperties properties = new WorkflowProperties();
            properties.getWorkflow().setTaskTimeoutSeconds(-5);

            assertNull(properties.getTaskTimeout());
        }

        @Test
        @DisplayName("positive timeouts become durations")
        void positiveTimeouts() {
            WorkflowProperties properties = new WorkflowProperties();
            properties.getWorkflow().setTaskTimeoutSeconds(15);
            properties.getWorkflow().setBatchTimeoutSeconds(90);

            assertEquals(Duration.ofSeconds(15), properties.getTaskTimeout());
            assertEquals(Duration.ofSeconds(90), properties.getBatchTimeout());
        }
    }
}
