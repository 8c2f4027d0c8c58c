package work.packhost.kernel.kv;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryKvStore implements KvStore {
    private final Map<String, Map<String, String>> namespaces = new ConcurrentHashMap<>();

    @Override
    public void put(String packId, String key, String valueJson) {
        Objects.requireNonNull(valueJson, "valueJson");
        namespace(packId).put(requireKey(key), valueJson);
    }

    @Override
    public Optional<String> get(String packId, String key) {
        var values = namespaces.get(requirePack(packId));
        return values == null ? Optional.empty() : Optional.ofNullable(values.get(requireKey(key)));
    }

    @Override
    public boolean delete(String packId, String key) {
        var values = namespaces.get(requirePack(packId));
        return values != null && values.remove(requireKey(key)) != null;
    }

    @Override
    public Set<String> keys(String packId) {
        var values = namespaces.get(requirePack(packId));
        return values == null ? Set.of() : new TreeSet<>(values.keySet());
    }

    @Override
    public void clear(String packId) {
        namespaces.remove(requirePack(packId));
    }

    private Map<String, String> namespace(String packId) {
        return namespaces.computeIfAbsent(requirePack(packId), ignored -> new ConcurrentHashMap<>());
    }

    static String requirePack(String packId) {
        if (packId == null || packId.isBlank()) {
            throw new IllegalArgumentException("packId is required");
        }
        return packId;
    }

    static String requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key is required");
        }
        return key;
    }
}
