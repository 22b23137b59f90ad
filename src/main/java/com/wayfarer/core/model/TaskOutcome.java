package com.wayfarer.core.model;

import java.util.Objects;

/**
 * Result of one {@link TaskSpec}: a payload of the kind's canonical type, or a reason.
 */
public sealed interface TaskOutcome permits TaskOutcome.Success, TaskOutcome.Failure {

    TaskKind kind();

    boolean succeeded();

    static TaskOutcome success(TaskPayload payload) {
        return new Success(payload.kind(), payload);
    }

    static TaskOutcome failure(TaskKind kind, String reason) {
        return new Failure(kind, reason);
    }

    record Success(TaskKind kind, TaskPayload payload) implements TaskOutcome {
        public Success {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(payload, "payload");
            if (!kind.accepts(payload)) {
                throw new IllegalArgumentException("Payload " + payload.getClass().getSimpleName()
                        + " does not belong to " + kind);
            }
        }

        @Override
        public boolean succeeded() {
            return true;
        }
    }

    record Failure(TaskKind kind, String reason) implements TaskOutcome {
        public Failure {
            Objects.requireNonNull(kind, "kind");
            reason = reason == null || reason.isBlank() ? "unknown error" : reason;
        }

        @Override
        public boolean succeeded() {
            return false;
        }
    }
}
