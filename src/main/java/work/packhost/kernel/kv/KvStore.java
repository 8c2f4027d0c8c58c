package work.packhost.kernel.kv;

import java.util.Optional;
import java.util.Set;

/**
 * Key-value storage namespaced by pack id. Values are JSON text. Two packs never see each other's
 * keys, even when the key names are equal.
 */
public interface KvStore {
    void put(String packId, String key, String valueJson);

    Optional<String> get(String packId, String key);

    boolean delete(String packId, String key);

    Set<String> keys(String packId);

    void clear(String packId);
}
