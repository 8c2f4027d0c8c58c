package work.packhost.kernel.error;

import java.util.Map;

/**
 * Another lifecycle transition for the same instance did not finish within the transition timeout.
 */
public final class TransitionInProgressException extends PackHostException {
    public TransitionInProgressException(String instanceId, String operation) {
        super("transition_in_progress",
            "Another transition is in progress for instance " + instanceId + "; " + operation + " rejected",
            Map.of("instanceId", instanceId));
    }
}
