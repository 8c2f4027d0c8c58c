package work.packhost.kernel.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.packhost.kernel.error.SandboxUnavailableException;

/**
 * JNI binding to the {@code packhost_sandbox} native library. Memory and CPU limits from the
 * capability JSON are enforced inside the engine; the CPU limit counts guest execution time
 * accounted per wall-clock second. Without the library every operation fails with
 * {@link SandboxUnavailableException}.
 */
public final class NativeSandboxEngine implements SandboxEngine {
    public static final String LIBRARY_NAME = "packhost_sandbox";

    private static final Logger log = LoggerFactory.getLogger(NativeSandboxEngine.class);
    private static final boolean LIBRARY_LOADED = loadLibrary();

    @Override
    public boolean isAvailable() {
        return LIBRARY_LOADED;
    }

    @Override
    public long loadModule(byte[] moduleBytes) {
        ensureAvailable();
        return nativeLoadModule(moduleBytes);
    }

    @Override
    public long instantiate(long moduleHandle, String capabilityJson) {
        ensureAvailable();
        return nativeInstantiate(moduleHandle, capabilityJson);
    }

    @Override
    public String call(long instanceHandle, String functionName, String argsJson) {
        ensureAvailable();
        return nativeCall(instanceHandle, functionName, argsJson);
    }

    @Override
    public void destroyInstance(long instanceHandle) {
        ensureAvailable();
        nativeDestroyInstance(instanceHandle);
    }

    @Override
    public void destroyModule(long moduleHandle) {
        ensureAvailable();
        nativeDestroyModule(moduleHandle);
    }

    private static void ensureAvailable() {
        if (!LIBRARY_LOADED) {
            throw new SandboxUnavailableException("Native library " + LIBRARY_NAME + " is not available on java.library.path");
        }
    }

    private static boolean loadLibrary() {
        try {
            System.loadLibrary(LIBRARY_NAME);
            log.info("Loaded native sandbox library {}", LIBRARY_NAME);
            return true;
        } catch (UnsatisfiedLinkError | SecurityException ex) {
            log.warn("Native sandbox library {} not loaded: {}", LIBRARY_NAME, ex.getMessage());
            return false;
        }
    }

    private static native long nativeLoadModule(byte[] moduleBytes);

    private static native long nativeInstantiate(long moduleHandle, String capabilityJson);

    private static native String nativeCall(long instanceHandle, String functionName, String argsJson);

    private static native void nativeDestroyInstance(long instanceHandle);

    private static native void nativeDestroyModule(long moduleHandle);
}
