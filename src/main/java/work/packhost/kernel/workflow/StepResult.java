package work.packhost.kernel.workflow;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one executed step. {@code error} is the {@code {code, message, data}} rendering of a
 * failure and is null on success.
 */
public record StepResult(String stepId, StepType type, boolean success, Object value, Map<String, Object> error, Instant startedAt, Instant finishedAt) {
    public static StepResult success(WorkflowStep step, Object value, Instant startedAt) {
        return new StepResult(step.id(), step.type(), true, value, null, startedAt, Instant.now());
    }

    public static StepResult failure(WorkflowStep step, Map<String, Object> error, Instant startedAt) {
        return new StepResult(step.id(), step.type(), false, null, error, startedAt, Instant.now());
    }
}
