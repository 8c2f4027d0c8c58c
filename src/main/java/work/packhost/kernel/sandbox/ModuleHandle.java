package work.packhost.kernel.sandbox;

/**
 * Opaque reference to a loaded module in a {@link SandboxRuntime} arena.
 */
public record ModuleHandle(int id) {
}
