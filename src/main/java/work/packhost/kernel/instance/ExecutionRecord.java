package work.packhost.kernel.instance;

import java.time.Instant;

/**
 * One execution segment of an instance, from start until completion, pause or stop.
 *
 * @param exitCode null when the segment ended with a pause
 */
public record ExecutionRecord(String instanceId, String packId, Instant startedAt, Instant finishedAt, Integer exitCode, String exitReason) {
}
