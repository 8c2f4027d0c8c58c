package work.packhost.kernel.sandbox;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.packhost.kernel.api.Result;
import work.packhost.kernel.error.InvalidHandleException;
import work.packhost.kernel.error.PackHostException;
import work.packhost.kernel.error.ResourceLimitExceededException;
import work.packhost.kernel.error.RuntimeTrapException;
import work.packhost.kernel.error.SandboxStateException;

/**
 * Handle arena over a {@link SandboxEngine}.
 *
 * <p>Module and instance handles are small integers owned by the caller. An instance must be
 * destroyed before its module. Calls on one instance run one at a time and are never preempted: a
 * destroy requested while a call is in flight marks the handle dead immediately and releases the
 * engine instance once the call returns. A trap or a resource-limit failure is terminal for the
 * instance, which the runtime then destroys itself.</p>
 */
public final class SandboxRuntime {
    private static final Logger log = LoggerFactory.getLogger(SandboxRuntime.class);

    private final SandboxEngine engine;
    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, ModuleEntry> modules = new ConcurrentHashMap<>();
    private final Map<Integer, InstanceEntry> instances = new ConcurrentHashMap<>();

    public SandboxRuntime(SandboxEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public boolean isAvailable() {
        return engine.isAvailable();
    }

    public ModuleHandle loadModule(byte[] moduleBytes) {
        Objects.requireNonNull(moduleBytes, "moduleBytes");
        long nativeHandle;
        try {
            nativeHandle = engine.loadModule(moduleBytes);
        } catch (SandboxEngineException ex) {
            throw new PackHostException("module_load_failed", "Failed to load module: " + ex.getMessage(), null, ex);
        }
        var handle = new ModuleHandle(nextId.getAndIncrement());
        modules.put(handle.id(), new ModuleEntry(nativeHandle));
        log.debug("Loaded module {} ({} bytes)", handle.id(), moduleBytes.length);
        return handle;
    }

    public InstanceHandle instantiate(ModuleHandle module, CapabilityDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        var moduleEntry = liveModule(module);
        synchronized (moduleEntry) {
            if (moduleEntry.destroyed) {
                throw new InvalidHandleException("module", module.id());
            }
            long nativeHandle;
            try {
                nativeHandle = engine.instantiate(moduleEntry.nativeHandle, descriptor.toJson());
            } catch (SandboxEngineException ex) {
                throw translate(ex, "Failed to instantiate module " + module.id());
            }
            var handle = new InstanceHandle(nextId.getAndIncrement(), module);
            instances.put(handle.id(), new InstanceEntry(handle, nativeHandle));
            moduleEntry.liveInstances.add(handle.id());
            log.debug("Instantiated module {} as instance {}", module.id(), handle.id());
            return handle;
        }
    }

    /**
     * Invokes an exported function. Trap and resource-limit failures destroy the instance.
     */
    public Result<String> call(InstanceHandle instance, String functionName, String argsJson) {
        return Result.capture(() -> {
            var entry = liveInstance(instance);
            entry.callLock.lock();
            try {
                if (entry.closing.get() || entry.destroyed) {
                    throw new InvalidHandleException("instance", instance.id());
                }
                try {
                    return engine.call(entry.nativeHandle, functionName, argsJson == null ? "{}" : argsJson);
                } catch (SandboxEngineException ex) {
                    var failure = translate(ex, "Call to " + functionName + " failed");
                    if (failure instanceof RuntimeTrapException || failure instanceof ResourceLimitExceededException) {
                        log.warn("Instance {} terminated: {}", instance.id(), failure.getMessage());
                        entry.closing.set(true);
                        release(entry);
                    }
                    throw failure;
                }
            } finally {
                entry.callLock.unlock();
                if (entry.closing.get()) {
                    releaseIfIdle(entry);
                }
            }
        });
    }

    /**
     * @return {@code true} when the engine instance was released now, {@code false} when release
     *     waits for an in-flight call
     */
    public boolean destroyInstance(InstanceHandle instance) {
        var entry = liveInstance(instance);
        if (!entry.closing.compareAndSet(false, true)) {
            throw new InvalidHandleException("instance", instance.id());
        }
        boolean released = releaseIfIdle(entry);
        if (!released) {
            log.debug("Instance {} busy; release deferred until the current call returns", instance.id());
        }
        return released;
    }

    public void destroyModule(ModuleHandle module) {
        var entry = liveModule(module);
        synchronized (entry) {
            if (entry.destroyed) {
                throw new InvalidHandleException("module", module.id());
            }
            if (!entry.liveInstances.isEmpty()) {
                throw new SandboxStateException("Module " + module.id() + " still has live instances " + entry.liveInstances);
            }
            entry.destroyed = true;
            modules.remove(module.id());
            try {
                engine.destroyModule(entry.nativeHandle);
            } catch (SandboxEngineException ex) {
                log.warn("Engine failed to release module {}: {}", module.id(), ex.getMessage());
            }
        }
    }

    public boolean isLive(InstanceHandle instance) {
        var entry = instance == null ? null : instances.get(instance.id());
        return entry != null && !entry.closing.get() && !entry.destroyed;
    }

    public boolean isLive(ModuleHandle module) {
        var entry = module == null ? null : modules.get(module.id());
        return entry != null && !entry.destroyed;
    }

    public int liveInstanceCount() {
        return instances.size();
    }

    /**
     * Releases every instance and module still held by the arena.
     */
    public void shutdown() {
        for (InstanceEntry entry : new ArrayList<>(instances.values())) {
            if (entry.closing.compareAndSet(false, true)) {
                releaseIfIdle(entry);
            }
        }
        for (Integer id : new ArrayList<>(modules.keySet())) {
            try {
                destroyModule(new ModuleHandle(id));
            } catch (PackHostException ex) {
                log.warn("Module {} not released at shutdown: {}", id, ex.getMessage());
            }
        }
    }

    private boolean releaseIfIdle(InstanceEntry entry) {
        if (!entry.callLock.tryLock()) {
            return false;
        }
        try {
            release(entry);
            return true;
        } finally {
            entry.callLock.unlock();
        }
    }

    // caller holds entry.callLock
    private void release(InstanceEntry entry) {
        if (entry.destroyed) {
            return;
        }
        entry.destroyed = true;
        instances.remove(entry.handle.id());
        try {
            engine.destroyInstance(entry.nativeHandle);
        } catch (SandboxEngineException ex) {
            log.warn("Engine failed to release instance {}: {}", entry.handle.id(), ex.getMessage());
        }
        var moduleEntry = modules.get(entry.handle.module().id());
        if (moduleEntry != null) {
            synchronized (moduleEntry) {
                moduleEntry.liveInstances.remove(entry.handle.id());
            }
        }
        log.debug("Released instance {}", entry.handle.id());
    }

    private ModuleEntry liveModule(ModuleHandle module) {
        Objects.requireNonNull(module, "module");
        var entry = modules.get(module.id());
        if (entry == null) {
            throw new InvalidHandleException("module", module.id());
        }
        return entry;
    }

    private InstanceEntry liveInstance(InstanceHandle instance) {
        Objects.requireNonNull(instance, "instance");
        var entry = instances.get(instance.id());
        if (entry == null || entry.closing.get() || !entry.handle.equals(instance)) {
            throw new InvalidHandleException("instance", instance.id());
        }
        return entry;
    }

    private static PackHostException translate(SandboxEngineException ex, String context) {
        return switch (ex.kind()) {
            case TRAP -> new RuntimeTrapException(context + ": " + ex.getMessage());
            case RESOURCE_LIMIT -> new ResourceLimitExceededException(context + ": " + ex.getMessage());
            case INVALID_HANDLE -> new PackHostException("invalid_handle", context + ": " + ex.getMessage(), null, ex);
            case LOAD_FAILED -> new PackHostException("module_load_failed", context + ": " + ex.getMessage(), null, ex);
            case ENGINE_ERROR -> new PackHostException("sandbox_engine_error", context + ": " + ex.getMessage(), null, ex);
        };
    }

    private static final class ModuleEntry {
        private final long nativeHandle;
        private final Set<Integer> liveInstances = new HashSet<>();
        private boolean destroyed;

        private ModuleEntry(long nativeHandle) {
            this.nativeHandle = nativeHandle;
        }
    }

    private static final class InstanceEntry {
        private final InstanceHandle handle;
        private final long nativeHandle;
        private final ReentrantLock callLock = new ReentrantLock();
        private final AtomicBoolean closing = new AtomicBoolean();
        private volatile boolean destroyed;

        private InstanceEntry(InstanceHandle handle, long nativeHandle) {
            this.handle = handle;
            this.nativeHandle = nativeHandle;
        }
    }
}
