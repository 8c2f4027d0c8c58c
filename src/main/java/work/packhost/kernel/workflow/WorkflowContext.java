package work.packhost.kernel.workflow;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import work.packhost.kernel.error.PackHostException;
import work.packhost.kernel.error.WorkflowCancelledException;
import work.packhost.kernel.pack.PackPermissions;
import work.packhost.kernel.sandbox.SandboxSession;

/**
 * State of one workflow run: step results, the resume position and the cancellation token. A
 * paused run keeps its context; starting it again continues after the last completed step.
 */
public final class WorkflowContext {
    private final String packId;
    private final String instanceId;
    private final PackPermissions permissions;
    private volatile SandboxSession sandbox;
    private final Map<String, StepResult> stepResults = new LinkedHashMap<>();
    private volatile CancellationToken cancellationToken = new CancellationToken();
    private int nextStepIndex;
    private final Map<String, Duration> pendingSleeps = new LinkedHashMap<>();

    public WorkflowContext(String packId, String instanceId, PackPermissions permissions) {
        this(packId, instanceId, permissions, null);
    }

    public WorkflowContext(String packId, String instanceId, PackPermissions permissions, SandboxSession sandbox) {
        this.packId = Objects.requireNonNull(packId, "packId");
        this.instanceId = instanceId;
        this.permissions = permissions == null ? PackPermissions.none() : permissions;
        this.sandbox = sandbox;
    }

    public String packId() {
        return packId;
    }

    public String instanceId() {
        return instanceId;
    }

    public PackPermissions permissions() {
        return permissions;
    }

    public Optional<SandboxSession> sandbox() {
        return Optional.ofNullable(sandbox);
    }

    /**
     * Replaces the sandbox session, e.g. when a paused run resumes with a fresh descriptor.
     */
    public void attachSandbox(SandboxSession session) {
        this.sandbox = session;
    }

    public void cancel() {
        cancellationToken.cancel();
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }

    /**
     * Gives a cancelled (paused) run a fresh token so it can be resumed.
     */
    public void resetCancellation() {
        if (cancellationToken.isCancelled()) {
            cancellationToken = new CancellationToken();
        }
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public void ensureNotCancelled(String workflowId) {
        if (cancellationToken.isCancelled()) {
            throw new WorkflowCancelledException(workflowId, successfulResults());
        }
    }

    public synchronized int nextStepIndex() {
        return nextStepIndex;
    }

    synchronized void advanceTo(int index) {
        this.nextStepIndex = index;
    }

    /**
     * Time left of a sleep step that a cancellation cut short, or {@code declared} when none is pending.
     */
    synchronized Duration remainingSleep(String stepId, Duration declared) {
        return pendingSleeps.getOrDefault(stepId, declared);
    }

    synchronized void deferSleep(String stepId, Duration remaining) {
        pendingSleeps.put(stepId, remaining.isNegative() ? Duration.ZERO : remaining);
    }

    synchronized boolean clearSleep(String stepId) {
        return pendingSleeps.remove(stepId) != null;
    }

    synchronized void record(StepResult result) {
        stepResults.put(result.stepId(), result);
    }

    public synchronized Optional<StepResult> stepResult(String stepId) {
        return Optional.ofNullable(stepResults.get(stepId));
    }

    public synchronized List<StepResult> stepResults() {
        return List.copyOf(stepResults.values());
    }

    /**
     * Values of succeeded steps in execution order. Null values are kept.
     */
    public synchronized Map<String, Object> successfulResults() {
        var values = new LinkedHashMap<String, Object>();
        for (StepResult result : stepResults.values()) {
            if (result.success()) {
                values.put(result.stepId(), result.value());
            }
        }
        return values;
    }

    /**
     * Resolves an {@code input_from} reference: a step id, optionally followed by a dotted path into
     * that step's value. Step ids containing dots win over path interpretation.
     */
    public synchronized Object resolveReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return null;
        }
        var segments = reference.split("\\.");
        for (int split = segments.length; split > 0; split--) {
            var candidate = String.join(".", Arrays.copyOfRange(segments, 0, split));
            var result = stepResults.get(candidate);
            if (result == null) {
                continue;
            }
            if (!result.success()) {
                throw new PackHostException("input_unavailable", "Step " + candidate + " did not succeed");
            }
            return getByPath(result.value(), Arrays.copyOfRange(segments, split, segments.length), reference);
        }
        throw new PackHostException("input_unavailable", "No result recorded for " + reference);
    }

    private static Object getByPath(Object value, String[] path, String reference) {
        Object current = value;
        for (String segment : path) {
            if (current instanceof Map<?, ?> map) {
                if (!map.containsKey(segment)) {
                    throw new PackHostException("input_unavailable", "Path " + reference + " not found");
                }
                current = map.get(segment);
            } else if (current instanceof List<?> list && isIndex(segment) && Integer.parseInt(segment) < list.size()) {
                current = list.get(Integer.parseInt(segment));
            } else {
                throw new PackHostException("input_unavailable", "Path " + reference + " not found");
            }
        }
        return current;
    }

    private static boolean isIndex(String segment) {
        return !segment.isEmpty() && segment.length() < 10 && segment.chars().allMatch(Character::isDigit);
    }

    /**
     * Cooperative cancellation flag. {@link #await(Duration)} lets waiting steps wake up early.
     */
    public static final class CancellationToken {
        private final CountDownLatch latch = new CountDownLatch(1);
        private volatile boolean cancelled = false;

        public void cancel() {
            this.cancelled = true;
            latch.countDown();
        }

        public boolean isCancelled() {
            return cancelled;
        }

        /**
         * @return {@code true} when cancelled before the timeout elapsed
         */
        public boolean await(Duration timeout) throws InterruptedException {
            return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}
