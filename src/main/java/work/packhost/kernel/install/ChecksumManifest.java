package work.packhost.kernel.install;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.packhost.kernel.error.ChecksumMismatchException;
import work.packhost.kernel.error.ZipSlipViolationException;
import work.packhost.kernel.shared.FileTrees;

/**
 * Parsed {@code checksums.sha256} sidecar: {@code <hex>  <relative-path>} per line. Blank lines and
 * lines starting with {@code #} are ignored.
 */
public final class ChecksumManifest {
    public static final String FILE_NAME = "checksums.sha256";

    private final Map<String, String> entries;

    private ChecksumManifest(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static ChecksumManifest parse(String content) {
        var entries = new LinkedHashMap<String, String>();
        if (content == null) {
            return new ChecksumManifest(entries);
        }
        for (String line : content.split("\\R")) {
            var trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            var parts = trimmed.split("\\s+", 2);
            if (parts.length != 2) {
                continue;
            }
            var path = parts[1].startsWith("*") ? parts[1].substring(1) : parts[1];
            entries.put(path, ChecksumVerifier.normalize(parts[0]));
        }
        return new ChecksumManifest(entries);
    }

    public static ChecksumManifest read(Path file) {
        try {
            return parse(Files.readString(file));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + file, ex);
        }
    }

    /** Relative path to lowercase hex digest, in file order. */
    public Map<String, String> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Checks every listed file under {@code root}. Listed paths must stay inside the root.
     */
    public void verifyEntries(Path root) {
        var base = root.toAbsolutePath().normalize();
        for (var entry : entries.entrySet()) {
            var target = base.resolve(entry.getKey()).normalize();
            if (!target.startsWith(base)) {
                throw new ZipSlipViolationException(entry.getKey());
            }
            try {
                FileTrees.requireInside(base, target, entry.getKey());
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to resolve " + entry.getKey(), ex);
            }
            if (!Files.isRegularFile(target)) {
                throw new ChecksumMismatchException(entry.getKey(), entry.getValue(), "missing");
            }
            var actual = ChecksumVerifier.sha256(target);
            if (!ChecksumVerifier.matches(actual, entry.getValue())) {
                throw new ChecksumMismatchException(entry.getKey(), entry.getValue(), actual);
            }
        }
    }
}
