package work.packhost.kernel.kv;

import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import work.packhost.kernel.shared.Json;

/**
 * Stores each pack's namespace as one JSON document, {@code <root>/<packId>.json}. Every mutation
 * rewrites the document through a temporary file and an atomic rename.
 */
public final class FileKvStore implements KvStore {
    private static final TypeReference<TreeMap<String, String>> DOCUMENT = new TypeReference<>() {};

    private final Path root;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public FileKvStore(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    @Override
    public void put(String packId, String key, String valueJson) {
        Objects.requireNonNull(valueJson, "valueJson");
        InMemoryKvStore.requireKey(key);
        synchronized (lockFor(packId)) {
            var document = read(packId);
            document.put(key, valueJson);
            write(packId, document);
        }
    }

    @Override
    public Optional<String> get(String packId, String key) {
        InMemoryKvStore.requireKey(key);
        synchronized (lockFor(packId)) {
            return Optional.ofNullable(read(packId).get(key));
        }
    }

    @Override
    public boolean delete(String packId, String key) {
        InMemoryKvStore.requireKey(key);
        synchronized (lockFor(packId)) {
            var document = read(packId);
            if (document.remove(key) == null) {
                return false;
            }
            write(packId, document);
            return true;
        }
    }

    @Override
    public Set<String> keys(String packId) {
        synchronized (lockFor(packId)) {
            return new TreeSet<>(read(packId).keySet());
        }
    }

    @Override
    public void clear(String packId) {
        synchronized (lockFor(packId)) {
            try {
                Files.deleteIfExists(documentPath(packId));
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to clear kv namespace " + packId, ex);
            }
        }
    }

    private Object lockFor(String packId) {
        return locks.computeIfAbsent(InMemoryKvStore.requirePack(packId), ignored -> new Object());
    }

    private Path documentPath(String packId) {
        var path = root.resolve(packId + ".json").normalize();
        if (!path.getParent().equals(root)) {
            throw new IllegalArgumentException("Invalid pack id for kv storage: " + packId);
        }
        return path;
    }

    private TreeMap<String, String> read(String packId) {
        var path = documentPath(packId);
        if (!Files.exists(path)) {
            return new TreeMap<>();
        }
        try {
            return Json.mapper().readValue(path.toFile(), DOCUMENT);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read kv namespace " + packId, ex);
        }
    }

    private void write(String packId, TreeMap<String, String> document) {
        var path = documentPath(packId);
        try {
            Files.createDirectories(root);
            var temp = Files.createTempFile(root, "." + packId, ".tmp");
            try {
                Json.mapper().writeValue(temp.toFile(), document);
                try {
                    Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException ex) {
                    Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write kv namespace " + packId, ex);
        }
    }
}
