package work.packhost.kernel.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link LogSink} forwarding pack output to the {@code packhost.pack} SLF4J logger.
 */
public final class Slf4jLogSink implements LogSink {
    private static final Logger log = LoggerFactory.getLogger("packhost.pack");

    @Override
    public void log(String instanceId, String packId, LogLevel level, String message, LogSource source) {
        var effective = level == null ? LogLevel.INFO : level;
        switch (effective) {
            case DEBUG -> log.debug("[{}/{}] {} {}", packId, instanceId, source, message);
            case INFO -> log.info("[{}/{}] {} {}", packId, instanceId, source, message);
            case WARN -> log.warn("[{}/{}] {} {}", packId, instanceId, source, message);
            case ERROR -> log.error("[{}/{}] {} {}", packId, instanceId, source, message);
        }
    }
}
