package work.packhost.kernel.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.packhost.kernel.error.InstanceNotFoundException;
import work.packhost.kernel.error.NotAuthenticatedException;
import work.packhost.kernel.error.PackHostException;
import work.packhost.kernel.error.PackNotFoundException;
import work.packhost.kernel.install.ArchiveExtractor;
import work.packhost.kernel.install.ArtifactSource;
import work.packhost.kernel.install.HttpArtifactSource;
import work.packhost.kernel.install.PackInstaller;
import work.packhost.kernel.install.PackStorage;
import work.packhost.kernel.instance.ExecutionHistory;
import work.packhost.kernel.instance.ExecutionRecord;
import work.packhost.kernel.instance.InMemoryExecutionHistory;
import work.packhost.kernel.instance.InMemoryInstanceRepository;
import work.packhost.kernel.instance.Instance;
import work.packhost.kernel.instance.InstanceLifecycle;
import work.packhost.kernel.instance.InstanceRepository;
import work.packhost.kernel.instance.InstanceState;
import work.packhost.kernel.instance.SecretProvider;
import work.packhost.kernel.kv.FileKvStore;
import work.packhost.kernel.kv.InMemoryKvStore;
import work.packhost.kernel.kv.KvStore;
import work.packhost.kernel.log.LogSink;
import work.packhost.kernel.log.Slf4jLogSink;
import work.packhost.kernel.pack.InMemoryPackRepository;
import work.packhost.kernel.pack.InstallSource;
import work.packhost.kernel.pack.Pack;
import work.packhost.kernel.pack.PackRepository;
import work.packhost.kernel.sandbox.CapabilityTranslator;
import work.packhost.kernel.sandbox.NativeSandboxEngine;
import work.packhost.kernel.sandbox.PermissionEnforcer;
import work.packhost.kernel.sandbox.SandboxEngine;
import work.packhost.kernel.sandbox.SandboxRuntime;
import work.packhost.kernel.shared.FileTrees;
import work.packhost.kernel.workflow.EventBus;
import work.packhost.kernel.workflow.WorkflowEngine;
import work.packhost.kernel.workflow.WorkflowProgress;

/**
 * Composition root of the kernel. Builds the installer, sandbox runtime, workflow engine and
 * instance lifecycle once from a {@link HostConfiguration} and exposes them through one facade.
 * Collaborators that live outside the kernel (artifact source, repositories, secrets, log sink,
 * sandbox engine) can be replaced through the {@link Builder}.
 */
public final class PackHost implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PackHost.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final HostConfiguration configuration;
    private final PackRepository packs;
    private final PackInstaller installer;
    private final SandboxRuntime sandbox;
    private final CapabilityTranslator translator;
    private final InstanceLifecycle lifecycle;
    private final SecretProvider secrets;
    private final KvStore kvStore;
    private final EventBus events;
    private final ExecutorService workers;

    private PackHost(Builder builder) {
        this.configuration = builder.configuration;
        this.packs = builder.packRepository != null ? builder.packRepository : new InMemoryPackRepository();
        this.secrets = builder.secretProvider != null ? builder.secretProvider : SecretProvider.NONE;
        this.kvStore = builder.kvStore != null ? builder.kvStore : defaultKvStore(configuration);
        this.events = new EventBus();

        var logSink = builder.logSink != null ? builder.logSink : new Slf4jLogSink();
        var artifactSource = builder.artifactSource != null
            ? builder.artifactSource
            : new HttpArtifactSource(configuration.downloadTimeout());
        var permissionEnforcer = new PermissionEnforcer();
        var storage = new PackStorage(configuration.packsDirectory(), configuration.stagingDirectory());
        storage.sweep();

        this.installer = new PackInstaller(
            storage,
            artifactSource,
            packs,
            new ArchiveExtractor(configuration.archiveLimits()),
            permissionEnforcer,
            configuration.enforcePackNaming()
        );
        this.sandbox = new SandboxRuntime(builder.sandboxEngine != null ? builder.sandboxEngine : new NativeSandboxEngine());
        this.workers = Executors.newFixedThreadPool(configuration.workerThreads(), new WorkerThreadFactory());
        var workflowEngine = new WorkflowEngine(kvStore, logSink, permissionEnforcer, events, configuration.httpTimeout());
        this.translator = new CapabilityTranslator(configuration.sandboxRoot(), configuration.inheritStdout(), configuration.inheritStderr());
        this.lifecycle = new InstanceLifecycle(
            builder.instanceRepository != null ? builder.instanceRepository : new InMemoryInstanceRepository(),
            builder.executionHistory != null ? builder.executionHistory : new InMemoryExecutionHistory(),
            translator,
            sandbox,
            workflowEngine,
            logSink,
            workers,
            configuration.transitionTimeout(),
            configuration.entryFunction()
        );
        if (!sandbox.isAvailable()) {
            log.warn("Sandbox engine not available; WASM packs cannot be started");
        }
    }

    public static Builder builder(HostConfiguration configuration) {
        return new Builder(configuration);
    }

    public static PackHost create(HostConfiguration configuration) {
        return builder(configuration).build();
    }

    public HostConfiguration configuration() {
        return configuration;
    }

    public EventBus events() {
        return events;
    }

    public KvStore kvStore() {
        return kvStore;
    }

    public boolean isSandboxAvailable() {
        return sandbox.isAvailable();
    }

    public Result<Pack> installFromUrl(String downloadUrl, InstallSource installSource, String expectedChecksum) {
        return installer.installFromUrl(downloadUrl, installSource, expectedChecksum);
    }

    public Result<Pack> installFromFile(Path archive, InstallSource installSource, String expectedChecksum) {
        return installer.installFromFile(archive, installSource, expectedChecksum);
    }

    /**
     * Uninstalls a pack once none of its instances is running or paused. Stopped instances, the
     * pack's sandbox directories and its key-value namespace are deleted with it.
     */
    public Result<Pack> uninstall(String packId) {
        var active = lifecycle.listForPack(packId).stream()
            .filter(instance -> instance.state() != InstanceState.STOPPED)
            .map(Instance::id)
            .toList();
        if (!active.isEmpty()) {
            return Result.failure(new PackHostException("pack_in_use", "Pack " + packId + " has active instances", Map.of("instances", active)));
        }
        for (Instance instance : lifecycle.listForPack(packId)) {
            var deleted = lifecycle.delete(instance.id());
            if (deleted.isFailure()) {
                return Result.failure(deleted.error());
            }
        }
        return installer.uninstall(packId).flatMap(pack -> Result.capture(() -> {
            kvStore.clear(pack.id());
            FileTrees.deleteRecursively(translator.packRoot(pack.id()));
            return pack;
        }));
    }

    public Optional<Pack> getPack(String packId) {
        return packs.getById(packId);
    }

    public List<Pack> listPacks() {
        return packs.list();
    }

    public Result<Instance> createInstance(String packId, String name) {
        return requirePack(packId).flatMap(pack -> lifecycle.create(pack, name));
    }

    public Result<Instance> startInstance(String instanceId) {
        return startInstance(instanceId, Map.of());
    }

    /**
     * Starts an instance with the secrets the {@link SecretProvider} holds for its pack, overlaid by
     * {@code envVars}.
     */
    public Result<Instance> startInstance(String instanceId, Map<String, String> envVars) {
        var instance = lifecycle.get(instanceId);
        if (instance.isEmpty()) {
            return Result.failure(new InstanceNotFoundException(instanceId));
        }
        return requirePack(instance.get().packId()).flatMap(pack -> Result.capture(() -> {
            var env = new LinkedHashMap<String, String>();
            if (envVars != null) {
                env.putAll(envVars);
            }
            var unresolved = pack.requiredSecrets().stream()
                .filter(name -> env.get(name) == null)
                .toList();
            if (!unresolved.isEmpty()) {
                if (!secrets.isAuthenticated()) {
                    throw new NotAuthenticatedException("Secret provider is not authenticated; cannot resolve secrets for " + pack.id());
                }
                secrets.getSecretsForPack(pack.id(), unresolved).forEach(env::putIfAbsent);
            }
            return lifecycle.start(instanceId, pack, env).getOrThrow();
        }));
    }

    public Result<Instance> pauseInstance(String instanceId) {
        return lifecycle.pause(instanceId);
    }

    public Result<Instance> stopInstance(String instanceId) {
        return lifecycle.stop(instanceId);
    }

    public Result<Instance> deleteInstance(String instanceId) {
        return lifecycle.delete(instanceId);
    }

    public Optional<Instance> getInstance(String instanceId) {
        return lifecycle.get(instanceId);
    }

    public List<Instance> listInstances() {
        return lifecycle.list();
    }

    public List<Instance> listInstances(String packId) {
        return lifecycle.listForPack(packId);
    }

    public List<ExecutionRecord> executionHistory(String instanceId) {
        return lifecycle.history(instanceId);
    }

    public Optional<WorkflowProgress> progress(String instanceId) {
        return lifecycle.progress(instanceId);
    }

    public Result<Instance> awaitIdle(String instanceId, Duration timeout) {
        return lifecycle.awaitIdle(instanceId, timeout);
    }

    /**
     * Stops every active instance, then releases the worker pool and the sandbox arena.
     */
    @Override
    public void close() {
        for (Instance instance : lifecycle.list()) {
            if (instance.state() != InstanceState.STOPPED) {
                var stopped = lifecycle.stop(instance.id());
                if (stopped.isFailure()) {
                    log.warn("Failed to stop instance {} on close: {}", instance.id(), stopped.error().getMessage());
                }
            }
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker pool did not terminate within {}", SHUTDOWN_GRACE);
                workers.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        sandbox.shutdown();
    }

    private Result<Pack> requirePack(String packId) {
        return packs.getById(packId)
            .map(Result::success)
            .orElseGet(() -> Result.failure(new PackNotFoundException(packId)));
    }

    private static KvStore defaultKvStore(HostConfiguration configuration) {
        return switch (configuration.kvBackend()) {
            case MEMORY -> new InMemoryKvStore();
            case FILE -> new FileKvStore(configuration.kvDirectory());
        };
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            var thread = new Thread(runnable, "packhost-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static final class Builder {
        private final HostConfiguration configuration;
        private SandboxEngine sandboxEngine;
        private ArtifactSource artifactSource;
        private PackRepository packRepository;
        private InstanceRepository instanceRepository;
        private ExecutionHistory executionHistory;
        private SecretProvider secretProvider;
        private LogSink logSink;
        private KvStore kvStore;

        private Builder(HostConfiguration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration");
        }

        public Builder sandboxEngine(SandboxEngine sandboxEngine) {
            this.sandboxEngine = sandboxEngine;
            return this;
        }

        public Builder artifactSource(ArtifactSource artifactSource) {
            this.artifactSource = artifactSource;
            return this;
        }

        public Builder packRepository(PackRepository packRepository) {
            this.packRepository = packRepository;
            return this;
        }

        public Builder instanceRepository(InstanceRepository instanceRepository) {
            this.instanceRepository = instanceRepository;
            return this;
        }

        public Builder executionHistory(ExecutionHistory executionHistory) {
            this.executionHistory = executionHistory;
            return this;
        }

        public Builder secretProvider(SecretProvider secretProvider) {
            this.secretProvider = secretProvider;
            return this;
        }

        public Builder logSink(LogSink logSink) {
            this.logSink = logSink;
            return this;
        }

        public Builder kvStore(KvStore kvStore) {
            this.kvStore = kvStore;
            return this;
        }

        public PackHost build() {
            return new PackHost(this);
        }
    }
}
