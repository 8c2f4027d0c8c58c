package work.packhost.kernel.instance;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.packhost.kernel.api.Result;
import work.packhost.kernel.error.IllegalStateTransitionException;
import work.packhost.kernel.error.InstanceNotFoundException;
import work.packhost.kernel.error.InvalidHandleException;
import work.packhost.kernel.error.MissingRequiredSecretsException;
import work.packhost.kernel.error.PackHostException;
import work.packhost.kernel.error.TransitionInProgressException;
import work.packhost.kernel.log.LogLevel;
import work.packhost.kernel.log.LogSink;
import work.packhost.kernel.log.LogSource;
import work.packhost.kernel.pack.Pack;
import work.packhost.kernel.sandbox.CapabilityDescriptor;
import work.packhost.kernel.sandbox.CapabilityTranslator;
import work.packhost.kernel.sandbox.InstanceHandle;
import work.packhost.kernel.sandbox.ModuleHandle;
import work.packhost.kernel.sandbox.SandboxRuntime;
import work.packhost.kernel.sandbox.SandboxSession;
import work.packhost.kernel.shared.FileTrees;
import work.packhost.kernel.workflow.Workflow;
import work.packhost.kernel.workflow.WorkflowContext;
import work.packhost.kernel.workflow.WorkflowEngine;
import work.packhost.kernel.workflow.WorkflowLoader;
import work.packhost.kernel.workflow.WorkflowProgress;
import work.packhost.kernel.workflow.WorkflowResult;

/**
 * Instance state machine.
 *
 * <pre>
 *   STOPPED --start--> RUNNING --pause--> PAUSED
 *      ^                  |                 |
 *      +------stop--------+------stop-------+
 *   PAUSED --start--> RUNNING
 * </pre>
 *
 * <p>Transitions for one instance id are serialised by a per-id lock; a transition that cannot
 * take the lock within the transition timeout fails with {@link TransitionInProgressException}.
 * Executions run on the worker executor. Each start bumps a per-instance generation so that a
 * completion arriving after a pause or stop is recognised as stale and ignored.</p>
 *
 * <p>Pausing a WASM instance destroys its sandbox instance; the next start instantiates the module
 * again and re-invokes the entry function. Pausing a workflow cancels it at the next step boundary
 * and keeps its context, so the next start continues after the last completed step.</p>
 */
public final class InstanceLifecycle {
    private static final Logger log = LoggerFactory.getLogger(InstanceLifecycle.class);

    private final InstanceRepository repository;
    private final ExecutionHistory history;
    private final CapabilityTranslator translator;
    private final SandboxRuntime sandbox;
    private final WorkflowEngine workflowEngine;
    private final LogSink logSink;
    private final Executor workers;
    private final Duration transitionTimeout;
    private final String entryFunction;
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    public InstanceLifecycle(
        InstanceRepository repository,
        ExecutionHistory history,
        CapabilityTranslator translator,
        SandboxRuntime sandbox,
        WorkflowEngine workflowEngine,
        LogSink logSink,
        Executor workers,
        Duration transitionTimeout,
        String entryFunction
    ) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.history = Objects.requireNonNull(history, "history");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox");
        this.workflowEngine = Objects.requireNonNull(workflowEngine, "workflowEngine");
        this.logSink = Objects.requireNonNull(logSink, "logSink");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.transitionTimeout = Objects.requireNonNull(transitionTimeout, "transitionTimeout");
        this.entryFunction = Objects.requireNonNull(entryFunction, "entryFunction");
    }

    public Result<Instance> create(Pack pack, String name) {
        return Result.capture(() -> {
            Objects.requireNonNull(pack, "pack");
            var instance = Instance.create(pack.id(), name == null || name.isBlank() ? pack.name() : name);
            repository.save(instance);
            log.info("Created instance {} of pack {}", instance.id(), pack.id());
            return instance;
        });
    }

    public Result<Instance> start(Instance instance, Pack pack, Map<String, String> envVars) {
        return start(instance.id(), pack, envVars);
    }

    public Result<Instance> start(String instanceId, Pack pack, Map<String, String> envVars) {
        return transition(instanceId, "start", slot -> {
            var current = require(instanceId);
            if (current.state() == InstanceState.RUNNING) {
                throw new IllegalStateTransitionException(instanceId, "start", current.state().name());
            }
            Objects.requireNonNull(pack, "pack");
            if (!pack.id().equals(current.packId())) {
                throw new PackHostException("pack_mismatch", "Instance " + instanceId + " belongs to pack " + current.packId() + ", not " + pack.id());
            }
            var env = envVars == null ? Map.<String, String>of() : envVars;
            var missing = new ArrayList<String>();
            for (String name : pack.requiredSecrets()) {
                if (env.get(name) == null) {
                    missing.add(name);
                }
            }
            if (!missing.isEmpty()) {
                throw new MissingRequiredSecretsException(missing);
            }
            awaitPreviousExecution(slot, instanceId);

            var descriptor = translator.build(pack.id(), pack.manifest().permissions(), env, pack.manifest().limits());
            translator.prepareHostDirectories(descriptor);
            long generation = slot.generation.incrementAndGet();
            var now = Instant.now();
            var execution = switch (pack.type()) {
                case WASM -> launchWasm(slot, current, pack, descriptor, generation, now);
                case WORKFLOW -> launchWorkflow(slot, current, pack, descriptor, generation, now);
            };
            var started = current.started(now);
            try {
                repository.save(started);
            } catch (RuntimeException ex) {
                slot.generation.incrementAndGet();
                execution.gate.completeExceptionally(ex);
                throw ex;
            }
            slot.current = execution;
            logSink.log(instanceId, pack.id(), LogLevel.INFO, "Instance started (" + pack.type().wireName() + ")", LogSource.RUNTIME);
            execution.gate.complete(null);
            return started;
        });
    }

    public Result<Instance> pause(Instance instance) {
        return pause(instance.id());
    }

    public Result<Instance> pause(String instanceId) {
        return transition(instanceId, "pause", slot -> {
            var current = require(instanceId);
            if (current.state() != InstanceState.RUNNING) {
                throw new IllegalStateTransitionException(instanceId, "pause", current.state().name());
            }
            slot.generation.incrementAndGet();
            var execution = slot.current;
            slot.current = null;
            if (execution != null) {
                execution.gate.complete(null);
                if (execution.workflowContext != null) {
                    execution.workflowContext.cancel();
                    slot.pausedContext = execution.workflowContext;
                }
                teardown(execution);
                history.record(new ExecutionRecord(instanceId, current.packId(), execution.startedAt, Instant.now(), null, "paused"));
            }
            var paused = current.paused();
            repository.save(paused);
            logSink.log(instanceId, current.packId(), LogLevel.INFO, "Instance paused", LogSource.RUNTIME);
            return paused;
        });
    }

    public Result<Instance> stop(Instance instance) {
        return stop(instance.id());
    }

    public Result<Instance> stop(String instanceId) {
        return transition(instanceId, "stop", slot -> {
            var current = require(instanceId);
            if (current.state() == InstanceState.STOPPED) {
                throw new IllegalStateTransitionException(instanceId, "stop", current.state().name());
            }
            return stopLocked(slot, current);
        });
    }

    /**
     * Deletes the instance, stopping it first when needed. Its execution history goes with it.
     */
    public Result<Instance> delete(String instanceId) {
        return transition(instanceId, "delete", slot -> {
            var current = require(instanceId);
            if (current.state() != InstanceState.STOPPED) {
                current = stopLocked(slot, current);
            }
            repository.delete(instanceId);
            history.deleteForInstance(instanceId);
            slots.remove(instanceId, slot);
            log.info("Deleted instance {}", instanceId);
            return current;
        });
    }

    public Optional<Instance> get(String instanceId) {
        return repository.findById(instanceId);
    }

    public List<Instance> list() {
        return repository.list();
    }

    public List<Instance> listForPack(String packId) {
        return repository.listForPack(packId);
    }

    public List<ExecutionRecord> history(String instanceId) {
        return history.forInstance(instanceId);
    }

    public Optional<WorkflowProgress> progress(String instanceId) {
        var slot = slots.get(instanceId);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.progress);
    }

    /**
     * Waits until the current execution of the instance has ended and its outcome is recorded.
     */
    public Result<Instance> awaitIdle(String instanceId, Duration timeout) {
        return Result.capture(() -> {
            var slot = slots.get(instanceId);
            var execution = slot == null ? null : slot.current;
            if (execution != null) {
                try {
                    execution.settled.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                } catch (TimeoutException ex) {
                    throw new PackHostException("await_timeout", "Instance " + instanceId + " still running after " + timeout);
                } catch (ExecutionException ex) {
                    log.debug("Execution of {} settled exceptionally", instanceId, ex.getCause());
                }
            }
            return require(instanceId);
        });
    }

    private Instance stopLocked(Slot slot, Instance current) {
        slot.generation.incrementAndGet();
        var execution = slot.current;
        slot.current = null;
        if (slot.pausedContext != null) {
            slot.pausedContext.cancel();
            slot.pausedContext = null;
        }
        var now = Instant.now();
        if (execution != null) {
            execution.gate.complete(null);
            if (execution.workflowContext != null) {
                execution.workflowContext.cancel();
            }
            teardown(execution);
            history.record(new ExecutionRecord(current.id(), current.packId(), execution.startedAt, now, ExitStatus.STOPPED.code(), ExitStatus.STOPPED.reason()));
        }
        var stopped = current.stopped(ExitStatus.STOPPED.code(), ExitStatus.STOPPED.reason(), now);
        repository.save(stopped);
        logSink.log(current.id(), current.packId(), LogLevel.INFO, "Instance stopped", LogSource.RUNTIME);
        return stopped;
    }

    private Execution launchWasm(Slot slot, Instance instance, Pack pack, CapabilityDescriptor descriptor, long generation, Instant now) {
        byte[] moduleBytes;
        try {
            FileTrees.requireInside(pack.installPath(), pack.entryPath(), pack.manifest().entry());
            moduleBytes = Files.readAllBytes(pack.entryPath());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read module " + pack.manifest().entry(), ex);
        }
        var module = sandbox.loadModule(moduleBytes);
        InstanceHandle handle;
        try {
            handle = sandbox.instantiate(module, descriptor);
        } catch (RuntimeException ex) {
            sandbox.destroyModule(module);
            throw ex;
        }
        var execution = new Execution(now, module, handle, null);
        var work = execution.gate.thenApplyAsync(ignored -> sandbox.call(handle, entryFunction, "{}"), workers);
        execution.work = work;
        execution.settled = work.handle((result, error) -> {
            releaseSandbox(handle, module);
            var failure = error != null ? error : result.isFailure() ? result.error() : null;
            finish(slot, instance.id(), pack.id(), generation, execution, failure);
            return null;
        });
        return execution;
    }

    private Execution launchWorkflow(Slot slot, Instance instance, Pack pack, CapabilityDescriptor descriptor, long generation, Instant now) {
        try {
            FileTrees.requireInside(pack.installPath(), pack.entryPath(), pack.manifest().entry());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to resolve workflow " + pack.manifest().entry(), ex);
        }
        Workflow workflow = WorkflowLoader.load(pack.entryPath());
        var context = slot.pausedContext != null
            ? slot.pausedContext
            : new WorkflowContext(pack.id(), instance.id(), pack.manifest().permissions());
        slot.pausedContext = null;
        context.resetCancellation();
        var session = new SandboxSession(sandbox, pack.installPath(), descriptor);
        context.attachSandbox(session);
        var execution = new Execution(now, null, null, context);
        CompletableFuture<Result<WorkflowResult>> work = execution.gate.thenComposeAsync(
            ignored -> workflowEngine.executeAsync(workflow, context, progress -> slot.progress = progress, workers),
            workers
        );
        execution.work = work;
        execution.settled = work.handle((result, error) -> {
            session.close();
            var failure = error != null ? error : result.isFailure() ? result.error() : null;
            finish(slot, instance.id(), pack.id(), generation, execution, failure);
            return null;
        });
        return execution;
    }

    /**
     * Records the natural end of an execution unless a later transition already superseded it.
     */
    private void finish(Slot slot, String instanceId, String packId, long generation, Execution execution, Throwable failure) {
        if (slot.generation.get() != generation) {
            return;
        }
        slot.lock.lock();
        try {
            if (slot.generation.get() != generation || slot.current != execution) {
                return;
            }
            slot.current = null;
            var status = failure == null ? ExitStatus.COMPLETED : ExitStatus.of(failure);
            var reason = failure == null ? status.reason() : status.describe(failure);
            var now = Instant.now();
            history.record(new ExecutionRecord(instanceId, packId, execution.startedAt, now, status.code(), reason));
            repository.findById(instanceId).ifPresent(current -> repository.save(current.stopped(status.code(), reason, now)));
            var level = failure == null ? LogLevel.INFO : LogLevel.ERROR;
            logSink.log(instanceId, packId, level, "Execution ended: " + reason + " (exit " + status.code() + ")", LogSource.RUNTIME);
        } finally {
            slot.lock.unlock();
        }
    }

    private void teardown(Execution execution) {
        if (execution.instanceHandle != null && sandbox.isLive(execution.instanceHandle)) {
            try {
                sandbox.destroyInstance(execution.instanceHandle);
            } catch (InvalidHandleException ex) {
                log.debug("Instance handle {} already released", execution.instanceHandle.id());
            }
        }
    }

    private void releaseSandbox(InstanceHandle handle, ModuleHandle module) {
        try {
            if (sandbox.isLive(handle)) {
                sandbox.destroyInstance(handle);
            }
            if (sandbox.isLive(module)) {
                sandbox.destroyModule(module);
            }
        } catch (PackHostException ex) {
            log.warn("Failed to release sandbox resources of module {}: {}", module.id(), ex.getMessage());
        }
    }

    private void awaitPreviousExecution(Slot slot, String instanceId) {
        var previous = slot.lastWork;
        if (previous == null || previous.isDone()) {
            return;
        }
        try {
            previous.get(transitionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            throw new TransitionInProgressException(instanceId, "start");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransitionInProgressException(instanceId, "start");
        } catch (ExecutionException ex) {
            log.debug("Previous execution of {} ended exceptionally", instanceId, ex.getCause());
        }
    }

    private Instance require(String instanceId) {
        return repository.findById(instanceId).orElseThrow(() -> new InstanceNotFoundException(instanceId));
    }

    private Result<Instance> transition(String instanceId, String operation, Transition body) {
        return Result.capture(() -> {
            Objects.requireNonNull(instanceId, "instanceId");
            var slot = slots.computeIfAbsent(instanceId, ignored -> new Slot());
            boolean locked;
            try {
                locked = slot.lock.tryLock(transitionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new TransitionInProgressException(instanceId, operation);
            }
            if (!locked) {
                throw new TransitionInProgressException(instanceId, operation);
            }
            try {
                var result = body.apply(slot);
                if (slot.current != null) {
                    slot.lastWork = slot.current.work;
                }
                return result;
            } finally {
                slot.lock.unlock();
            }
        });
    }

    @FunctionalInterface
    private interface Transition {
        Instance apply(Slot slot);
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private final AtomicLong generation = new AtomicLong();
        private volatile Execution current;
        private volatile CompletableFuture<?> lastWork;
        private volatile WorkflowContext pausedContext;
        private volatile WorkflowProgress progress;
    }

    private static final class Execution {
        private final Instant startedAt;
        private final ModuleHandle module;
        private final InstanceHandle instanceHandle;
        private final WorkflowContext workflowContext;
        private final CompletableFuture<Void> gate = new CompletableFuture<>();
        private volatile CompletableFuture<?> work;
        private volatile CompletableFuture<?> settled;

        private Execution(Instant startedAt, ModuleHandle module, InstanceHandle instanceHandle, WorkflowContext workflowContext) {
            this.startedAt = startedAt;
            this.module = module;
            this.instanceHandle = instanceHandle;
            this.workflowContext = workflowContext;
        }
    }
}
