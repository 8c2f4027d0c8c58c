package work.packhost.kernel.workflow;

/**
 * Snapshot published after every step transition.
 */
public record WorkflowProgress(String workflowId, int currentStep, int totalSteps, String message, int percent) {
    public static WorkflowProgress of(String workflowId, int currentStep, int totalSteps, String message) {
        int percent = totalSteps > 0 ? (int) (currentStep * 100L / totalSteps) : 0;
        return new WorkflowProgress(workflowId, currentStep, totalSteps, message, percent);
    }
}
