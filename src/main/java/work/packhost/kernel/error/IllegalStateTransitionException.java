package work.packhost.kernel.error;

import java.util.LinkedHashMap;
import java.util.Map;

public final class IllegalStateTransitionException extends PackHostException {
    public IllegalStateTransitionException(String instanceId, String operation, String currentState) {
        super("illegal_state_transition",
            "Cannot " + operation + " instance " + instanceId + " while it is " + currentState,
            details(instanceId, operation, currentState));
    }

    private static Map<String, Object> details(String instanceId, String operation, String state) {
        var map = new LinkedHashMap<String, Object>();
        map.put("instanceId", instanceId);
        map.put("operation", operation);
        map.put("state", state);
        return map;
    }
}
