package work.packhost.kernel.workflow;

import java.time.Instant;

/**
 * Typed event published by an {@code emit.event} step.
 */
public record WorkflowEvent(String eventType, String packId, String instanceId, String workflowId, String stepId, Object payload, Instant timestamp) {
}
