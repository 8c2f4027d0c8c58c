package work.packhost.kernel.workflow;

@FunctionalInterface
public interface WorkflowProgressListener {
    WorkflowProgressListener NONE = progress -> {};

    void onProgress(WorkflowProgress progress);
}
