package work.packhost.kernel.error;

import java.util.Map;

public final class NetworkCapabilityDeniedException extends CapabilityDeniedException {
    public NetworkCapabilityDeniedException(String packId, String target) {
        super("network_capability_denied",
            "Pack " + packId + " is not allowed to connect to " + target,
            Map.of("packId", packId, "target", target));
    }
}
