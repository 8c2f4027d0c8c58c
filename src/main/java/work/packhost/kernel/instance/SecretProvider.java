package work.packhost.kernel.instance;

import java.util.List;
import java.util.Map;

/**
 * Supplies secret values for a pack's {@code required_env} names. Names without a stored value are
 * left out of the returned map.
 */
public interface SecretProvider {
    SecretProvider NONE = new SecretProvider() {
        @Override
        public boolean isAuthenticated() {
            return true;
        }

        @Override
        public Map<String, String> getSecretsForPack(String packId, List<String> requiredEnv) {
            return Map.of();
        }
    };

    boolean isAuthenticated();

    Map<String, String> getSecretsForPack(String packId, List<String> requiredEnv);
}
