package work.packhost.kernel.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class WorkflowCancelledException extends PackHostException {
    private final Map<String, ?> partialResults;

    public WorkflowCancelledException(String workflowId, Map<String, ?> partialResults) {
        super("workflow_cancelled", "Workflow " + workflowId + " cancelled");
        this.partialResults = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(partialResults));
    }

    public Map<String, ?> partialResults() {
        return partialResults;
    }
}
