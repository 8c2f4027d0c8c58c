package work.packhost.kernel.sandbox;

import java.util.Objects;

/**
 * Opaque reference to a live instance. Keeps the module it was instantiated from.
 */
public record InstanceHandle(int id, ModuleHandle module) {
    public InstanceHandle {
        Objects.requireNonNull(module, "module");
    }
}
