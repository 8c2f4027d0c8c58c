package work.packhost.kernel.instance;

import work.packhost.kernel.error.HostErrors;
import work.packhost.kernel.error.ResourceLimitExceededException;
import work.packhost.kernel.error.RuntimeTrapException;
import work.packhost.kernel.error.WorkflowCancelledException;
import work.packhost.kernel.error.WorkflowStepFailureException;

/**
 * Exit codes recorded when an execution ends.
 */
public enum ExitStatus {
    COMPLETED(0, "completed"),
    STOPPED(0, "stopped"),
    FAILED(1, "failed"),
    TRAP(2, "runtime_trap"),
    RESOURCE_LIMIT(3, "resource_limit_exceeded");

    private final int code;
    private final String reason;

    ExitStatus(int code, String reason) {
        this.code = code;
        this.reason = reason;
    }

    public int code() {
        return code;
    }

    public String reason() {
        return reason;
    }

    /**
     * Classifies an execution failure. Step failures are classified by their cause.
     */
    public static ExitStatus of(Throwable failure) {
        var cause = failure instanceof WorkflowStepFailureException stepFailure && stepFailure.getCause() != null
            ? stepFailure.getCause()
            : failure;
        if (cause instanceof RuntimeTrapException) {
            return TRAP;
        }
        if (cause instanceof ResourceLimitExceededException) {
            return RESOURCE_LIMIT;
        }
        if (cause instanceof WorkflowCancelledException) {
            return STOPPED;
        }
        return FAILED;
    }

    public String describe(Throwable failure) {
        if (failure == null) {
            return reason;
        }
        return reason + ": " + HostErrors.normalize(failure).getMessage();
    }
}
