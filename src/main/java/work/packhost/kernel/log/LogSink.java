package work.packhost.kernel.log;

/**
 * Receives log lines emitted on behalf of a pack instance. Implementations must be thread-safe;
 * lines from different instances may arrive concurrently.
 */
@FunctionalInterface
public interface LogSink {
    void log(String instanceId, String packId, LogLevel level, String message, LogSource source);
}
