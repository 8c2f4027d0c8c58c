package work.packhost.kernel.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wraps the cause of the first failing workflow step. Results of the steps that ran before it
 * are kept in {@link #partialResults()}.
 */
public final class WorkflowStepFailureException extends PackHostException {
    private final String stepId;
    private final Map<String, ?> partialResults;

    public WorkflowStepFailureException(String stepId, Throwable cause, Map<String, ?> partialResults) {
        super("workflow_step_failure", "Step " + stepId + " failed: " + HostErrors.describe(cause),
            Map.of("stepId", stepId, "cause", HostErrors.toMap(cause)), cause);
        this.stepId = stepId;
        this.partialResults = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(partialResults));
    }

    public String stepId() {
        return stepId;
    }

    public Map<String, ?> partialResults() {
        return partialResults;
    }
}
