package work.packhost.kernel.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import work.packhost.kernel.install.ArchiveLimits;

/**
 * Immutable configuration of a {@link PackHost}. Storage locations derive from the data directory
 * unless set explicitly.
 */
public record HostConfiguration(
    Path dataDirectory,
    Path packsDirectory,
    Path stagingDirectory,
    Path sandboxRoot,
    Path kvDirectory,
    KvBackend kvBackend,
    Duration transitionTimeout,
    Duration httpTimeout,
    Duration downloadTimeout,
    boolean inheritStdout,
    boolean inheritStderr,
    boolean enforcePackNaming,
    ArchiveLimits archiveLimits,
    String entryFunction,
    int workerThreads
) {
    public static final Duration DEFAULT_TRANSITION_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_DOWNLOAD_TIMEOUT = Duration.ofMinutes(5);
    public static final String DEFAULT_ENTRY_FUNCTION = "_start";

    public enum KvBackend {
        MEMORY,
        FILE;

        public static KvBackend from(String raw) {
            if (raw == null || raw.isBlank()) {
                return MEMORY;
            }
            return switch (raw.trim().toLowerCase()) {
                case "memory" -> MEMORY;
                case "file" -> FILE;
                default -> throw new IllegalArgumentException("Unknown kv backend: " + raw);
            };
        }
    }

    public HostConfiguration {
        Objects.requireNonNull(dataDirectory, "dataDirectory");
        Objects.requireNonNull(packsDirectory, "packsDirectory");
        Objects.requireNonNull(stagingDirectory, "stagingDirectory");
        Objects.requireNonNull(sandboxRoot, "sandboxRoot");
        Objects.requireNonNull(kvDirectory, "kvDirectory");
        Objects.requireNonNull(kvBackend, "kvBackend");
        Objects.requireNonNull(transitionTimeout, "transitionTimeout");
        Objects.requireNonNull(httpTimeout, "httpTimeout");
        Objects.requireNonNull(downloadTimeout, "downloadTimeout");
        Objects.requireNonNull(archiveLimits, "archiveLimits");
        Objects.requireNonNull(entryFunction, "entryFunction");
        if (entryFunction.isBlank()) {
            throw new IllegalArgumentException("entryFunction must not be blank");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static HostConfiguration defaults(Path dataDirectory) {
        return builder().dataDirectory(dataDirectory).build();
    }

    public static final class Builder {
        private Path dataDirectory;
        private Path packsDirectory;
        private Path stagingDirectory;
        private Path sandboxRoot;
        private Path kvDirectory;
        private KvBackend kvBackend = KvBackend.MEMORY;
        private Duration transitionTimeout = DEFAULT_TRANSITION_TIMEOUT;
        private Duration httpTimeout = DEFAULT_HTTP_TIMEOUT;
        private Duration downloadTimeout = DEFAULT_DOWNLOAD_TIMEOUT;
        private boolean inheritStdout = true;
        private boolean inheritStderr = true;
        private boolean enforcePackNaming;
        private ArchiveLimits archiveLimits = ArchiveLimits.defaults();
        private String entryFunction = DEFAULT_ENTRY_FUNCTION;
        private int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

        public Builder dataDirectory(Path dataDirectory) {
            this.dataDirectory = dataDirectory;
            return this;
        }

        public Builder packsDirectory(Path packsDirectory) {
            this.packsDirectory = packsDirectory;
            return this;
        }

        public Builder stagingDirectory(Path stagingDirectory) {
            this.stagingDirectory = stagingDirectory;
            return this;
        }

        public Builder sandboxRoot(Path sandboxRoot) {
            this.sandboxRoot = sandboxRoot;
            return this;
        }

        public Builder kvDirectory(Path kvDirectory) {
            this.kvDirectory = kvDirectory;
            return this;
        }

        public Builder kvBackend(KvBackend kvBackend) {
            this.kvBackend = kvBackend;
            return this;
        }

        public Builder transitionTimeout(Duration transitionTimeout) {
            this.transitionTimeout = transitionTimeout;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder downloadTimeout(Duration downloadTimeout) {
            this.downloadTimeout = downloadTimeout;
            return this;
        }

        public Builder inheritStdout(boolean inheritStdout) {
            this.inheritStdout = inheritStdout;
            return this;
        }

        public Builder inheritStderr(boolean inheritStderr) {
            this.inheritStderr = inheritStderr;
            return this;
        }

        public Builder enforcePackNaming(boolean enforcePackNaming) {
            this.enforcePackNaming = enforcePackNaming;
            return this;
        }

        public Builder archiveLimits(ArchiveLimits archiveLimits) {
            this.archiveLimits = archiveLimits;
            return this;
        }

        public Builder entryFunction(String entryFunction) {
            this.entryFunction = entryFunction;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public HostConfiguration build() {
            Objects.requireNonNull(dataDirectory, "dataDirectory");
            var data = dataDirectory.toAbsolutePath().normalize();
            return new HostConfiguration(
                data,
                packsDirectory != null ? packsDirectory : data.resolve("packs"),
                stagingDirectory != null ? stagingDirectory : data.resolve("staging"),
                sandboxRoot != null ? sandboxRoot : data.resolve("sandbox"),
                kvDirectory != null ? kvDirectory : data.resolve("kv"),
                kvBackend,
                transitionTimeout,
                httpTimeout,
                downloadTimeout,
                inheritStdout,
                inheritStderr,
                enforcePackNaming,
                archiveLimits,
                entryFunction,
                workerThreads
            );
        }
    }
}
