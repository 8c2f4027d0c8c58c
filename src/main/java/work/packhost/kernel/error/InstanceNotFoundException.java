package work.packhost.kernel.error;

import java.util.Map;

public final class InstanceNotFoundException extends PackHostException {
    public InstanceNotFoundException(String instanceId) {
        super("instance_not_found", "Instance not found: " + instanceId, Map.of("instanceId", instanceId));
    }
}
