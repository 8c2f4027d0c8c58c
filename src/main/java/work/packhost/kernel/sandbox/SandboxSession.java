package work.packhost.kernel.sandbox;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.packhost.kernel.error.ManifestInvalidException;
import work.packhost.kernel.error.PackHostException;
import work.packhost.kernel.shared.FileTrees;

/**
 * Modules of one pack instantiated on demand with a fixed capability descriptor. Used by workflow
 * runs; {@link #close()} releases every instance and module the session created.
 */
public final class SandboxSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SandboxSession.class);

    private final SandboxRuntime runtime;
    private final Path packRoot;
    private final CapabilityDescriptor descriptor;
    private final Map<String, InstanceHandle> instances = new LinkedHashMap<>();
    private boolean closed;

    public SandboxSession(SandboxRuntime runtime, Path packRoot, CapabilityDescriptor descriptor) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.packRoot = Objects.requireNonNull(packRoot, "packRoot").toAbsolutePath().normalize();
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    }

    public CapabilityDescriptor descriptor() {
        return descriptor;
    }

    /**
     * Calls {@code function} of the pack-relative {@code module}, instantiating it on first use.
     * A trap or limit failure drops the cached instance; the next call re-instantiates.
     */
    public synchronized String call(String module, String function, String argsJson) {
        if (closed) {
            throw new PackHostException("sandbox_session_closed", "Sandbox session is closed");
        }
        var handle = instances.get(module);
        if (handle == null || !runtime.isLive(handle)) {
            if (handle != null) {
                instances.remove(module);
                releaseModule(handle.module());
            }
            handle = instantiate(module);
            instances.put(module, handle);
        }
        var result = runtime.call(handle, function, argsJson);
        if (result.isFailure() && !runtime.isLive(handle)) {
            instances.remove(module);
            releaseModule(handle.module());
        }
        return result.getOrThrow();
    }

    synchronized Optional<InstanceHandle> cachedInstance(String module) {
        return Optional.ofNullable(instances.get(module));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (InstanceHandle handle : instances.values()) {
            if (runtime.isLive(handle)) {
                runtime.destroyInstance(handle);
            }
            releaseModule(handle.module());
        }
        instances.clear();
    }

    private InstanceHandle instantiate(String module) {
        var modulePath = packRoot.resolve(module).normalize();
        if (!modulePath.startsWith(packRoot)) {
            throw new ManifestInvalidException("Module path escapes the pack: " + module);
        }
        byte[] bytes;
        try {
            FileTrees.requireInside(packRoot, modulePath, module);
            bytes = Files.readAllBytes(modulePath);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read module " + module, ex);
        }
        var moduleHandle = runtime.loadModule(bytes);
        try {
            return runtime.instantiate(moduleHandle, descriptor);
        } catch (RuntimeException ex) {
            runtime.destroyModule(moduleHandle);
            throw ex;
        }
    }

    private void releaseModule(ModuleHandle module) {
        if (!runtime.isLive(module)) {
            return;
        }
        try {
            runtime.destroyModule(module);
        } catch (PackHostException ex) {
            log.debug("Module {} kept: {}", module.id(), ex.getMessage());
        }
    }
}
