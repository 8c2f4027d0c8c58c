package work.packhost.kernel.log;

public enum LogSource {
    RUNTIME,
    WORKFLOW_STEP,
    INSTALLER,
    STDOUT,
    STDERR
}
