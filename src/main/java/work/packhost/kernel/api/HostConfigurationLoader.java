package work.packhost.kernel.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.packhost.kernel.error.PackHostException;
import work.packhost.kernel.install.ArchiveLimits;
import work.packhost.kernel.shared.DurationParser;

/**
 * Reads {@code packhost.toml}.
 *
 * <pre>
 * [storage]
 * data_dir = "/var/lib/packhost"   # relative paths resolve against the file's directory
 * kv_backend = "file"              # memory | file
 *
 * [lifecycle]
 * transition_timeout = "5s"
 * entry_function = "_start"
 * worker_threads = 4
 *
 * [network]
 * http_timeout = "30s"
 * download_timeout = "5m"
 * enforce_pack_naming = true
 *
 * [sandbox]
 * root = "sandbox"
 * inherit_stdout = true
 * inherit_stderr = true
 *
 * [archive]
 * max_entries = 10000
 * max_total_bytes = 536870912
 * </pre>
 *
 * Missing keys keep the {@link HostConfiguration.Builder} defaults.
 */
public final class HostConfigurationLoader {
    public static final String DEFAULT_FILE_NAME = "packhost.toml";

    private HostConfigurationLoader() {}

    public static HostConfiguration load(Path file) {
        var path = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new PackHostException("config_invalid", "Configuration file not found: " + path);
        }
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + path, ex);
        }
        var base = path.getParent() != null ? path.getParent() : Path.of("").toAbsolutePath();
        return parse(content, base);
    }

    public static HostConfiguration parse(String content, Path baseDirectory) {
        TomlParseResult toml = Toml.parse(content);
        if (toml.hasErrors()) {
            var message = toml.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new PackHostException("config_invalid", "Invalid configuration: " + message);
        }
        try {
            return toBuilder(toml, baseDirectory).build();
        } catch (IllegalArgumentException | ArithmeticException | TomlInvalidTypeException ex) {
            throw new PackHostException("config_invalid", "Invalid configuration: " + ex.getMessage(), null, ex);
        }
    }

    private static HostConfiguration.Builder toBuilder(TomlParseResult toml, Path base) {
        var builder = HostConfiguration.builder().dataDirectory(base.resolve("data"));

        TomlTable storage = toml.getTable("storage");
        if (storage != null) {
            var dataDir = storage.getString("data_dir");
            if (dataDir != null && !dataDir.isBlank()) {
                builder.dataDirectory(base.resolve(dataDir));
            }
            var packsDir = storage.getString("packs_dir");
            if (packsDir != null && !packsDir.isBlank()) {
                builder.packsDirectory(base.resolve(packsDir));
            }
            var stagingDir = storage.getString("staging_dir");
            if (stagingDir != null && !stagingDir.isBlank()) {
                builder.stagingDirectory(base.resolve(stagingDir));
            }
            var kvDir = storage.getString("kv_dir");
            if (kvDir != null && !kvDir.isBlank()) {
                builder.kvDirectory(base.resolve(kvDir));
            }
            builder.kvBackend(HostConfiguration.KvBackend.from(storage.getString("kv_backend")));
        }

        TomlTable lifecycle = toml.getTable("lifecycle");
        if (lifecycle != null) {
            DurationParser.parse(lifecycle.getString("transition_timeout")).ifPresent(builder::transitionTimeout);
            var entry = lifecycle.getString("entry_function");
            if (entry != null) {
                builder.entryFunction(entry);
            }
            var workers = lifecycle.getLong("worker_threads");
            if (workers != null) {
                builder.workerThreads(Math.toIntExact(workers));
            }
        }

        TomlTable network = toml.getTable("network");
        if (network != null) {
            DurationParser.parse(network.getString("http_timeout")).ifPresent(builder::httpTimeout);
            DurationParser.parse(network.getString("download_timeout")).ifPresent(builder::downloadTimeout);
            var naming = network.getBoolean("enforce_pack_naming");
            if (naming != null) {
                builder.enforcePackNaming(naming);
            }
        }

        TomlTable sandbox = toml.getTable("sandbox");
        if (sandbox != null) {
            var root = sandbox.getString("root");
            if (root != null && !root.isBlank()) {
                builder.sandboxRoot(base.resolve(root));
            }
            var stdout = sandbox.getBoolean("inherit_stdout");
            if (stdout != null) {
                builder.inheritStdout(stdout);
            }
            var stderr = sandbox.getBoolean("inherit_stderr");
            if (stderr != null) {
                builder.inheritStderr(stderr);
            }
        }

        TomlTable archive = toml.getTable("archive");
        if (archive != null) {
            var maxEntries = archive.getLong("max_entries");
            var maxBytes = archive.getLong("max_total_bytes");
            builder.archiveLimits(new ArchiveLimits(
                maxEntries != null ? Math.toIntExact(maxEntries) : ArchiveLimits.DEFAULT_MAX_ENTRIES,
                maxBytes != null ? maxBytes : ArchiveLimits.DEFAULT_MAX_TOTAL_BYTES
            ));
        }
        return builder;
    }
}
