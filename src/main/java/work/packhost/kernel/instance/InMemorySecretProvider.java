package work.packhost.kernel.instance;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Secrets kept in memory, scoped per pack id.
 */
public final class InMemorySecretProvider implements SecretProvider {
    private final Map<String, Map<String, String>> secrets = new ConcurrentHashMap<>();

    public InMemorySecretProvider put(String packId, String name, String value) {
        secrets.computeIfAbsent(packId, ignored -> new ConcurrentHashMap<>()).put(name, value);
        return this;
    }

    @Override
    public boolean isAuthenticated() {
        return true;
    }

    @Override
    public Map<String, String> getSecretsForPack(String packId, List<String> requiredEnv) {
        var stored = secrets.getOrDefault(packId, Map.of());
        var resolved = new LinkedHashMap<String, String>();
        for (String name : requiredEnv) {
            var value = stored.get(name);
            if (value != null) {
                resolved.put(name, value);
            }
        }
        return resolved;
    }
}
