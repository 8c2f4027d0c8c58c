package work.packhost.kernel.error;

import java.util.Map;

public final class PackNotFoundException extends PackHostException {
    public PackNotFoundException(String packId) {
        super("pack_not_found", "Pack not found: " + packId, Map.of("packId", packId));
    }
}
