package work.packhost.kernel.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values of all steps of a completed run, keyed by step id in execution order.
 */
public record WorkflowResult(String workflowId, String packId, String instanceId, Map<String, Object> stepResults) {
    public WorkflowResult {
        stepResults = stepResults == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stepResults));
    }
}
