package work.packhost.kernel.error;

public final class InvalidWorkflowException extends PackHostException {
    public InvalidWorkflowException(String message) {
        super("workflow_invalid", message);
    }

    public InvalidWorkflowException(String message, Throwable cause) {
        super("workflow_invalid", message, null, cause);
    }
}
