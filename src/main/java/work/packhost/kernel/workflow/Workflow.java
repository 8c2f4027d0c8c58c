package work.packhost.kernel.workflow;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import work.packhost.kernel.error.InvalidWorkflowException;

/**
 * Parsed {@code workflow.json}.
 */
public record Workflow(String workflowVersion, String id, String description, List<WorkflowStep> steps) {
    public Workflow {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * Rejects workflows without an id, without steps, or with blank or repeated step ids.
     */
    public void validate() {
        if (id == null || id.isBlank()) {
            throw new InvalidWorkflowException("Workflow id cannot be blank");
        }
        if (steps.isEmpty()) {
            throw new InvalidWorkflowException("Workflow " + id + " must have at least one step");
        }
        var seen = new HashSet<String>();
        var duplicates = new LinkedHashSet<String>();
        for (WorkflowStep step : steps) {
            if (step.id() == null || step.id().isBlank()) {
                throw new InvalidWorkflowException("Workflow " + id + " has a step without id");
            }
            if (!seen.add(step.id())) {
                duplicates.add(step.id());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new InvalidWorkflowException("Duplicate step ids in workflow " + id + ": " + duplicates);
        }
    }
}
