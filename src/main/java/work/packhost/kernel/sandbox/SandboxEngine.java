package work.packhost.kernel.sandbox;

/**
 * Contract of the embedded execution engine. Handles are raw engine values; ownership and validity
 * tracking belong to {@link SandboxRuntime}. Failures are reported as {@link SandboxEngineException}.
 */
public interface SandboxEngine {
    long loadModule(byte[] moduleBytes);

    long instantiate(long moduleHandle, String capabilityJson);

    String call(long instanceHandle, String functionName, String argsJson);

    void destroyInstance(long instanceHandle);

    void destroyModule(long moduleHandle);

    default boolean isAvailable() {
        return true;
    }
}
