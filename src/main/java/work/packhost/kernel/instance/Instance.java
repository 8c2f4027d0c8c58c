package work.packhost.kernel.instance;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Persisted view of a pack instance. Transitions produce new records; only
 * {@link InstanceLifecycle} creates them.
 */
public record Instance(
    String id,
    String packId,
    String name,
    InstanceState state,
    Instant createdAt,
    Instant startedAt,
    Instant stoppedAt,
    Integer lastExitCode,
    String lastExitReason
) {
    public Instance {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(packId, "packId");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    static Instance create(String packId, String name) {
        return new Instance(UUID.randomUUID().toString(), packId, name, InstanceState.STOPPED, Instant.now(), null, null, null, null);
    }

    Instance started(Instant now) {
        return new Instance(id, packId, name, InstanceState.RUNNING, createdAt, now, stoppedAt, lastExitCode, lastExitReason);
    }

    Instance paused() {
        return new Instance(id, packId, name, InstanceState.PAUSED, createdAt, startedAt, stoppedAt, lastExitCode, lastExitReason);
    }

    Instance stopped(int exitCode, String exitReason, Instant now) {
        return new Instance(id, packId, name, InstanceState.STOPPED, createdAt, startedAt, now, exitCode, exitReason);
    }

    public boolean isRunning() {
        return state == InstanceState.RUNNING;
    }
}
