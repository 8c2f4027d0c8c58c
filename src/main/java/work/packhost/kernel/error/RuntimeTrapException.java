package work.packhost.kernel.error;

/**
 * Guest code faulted. Terminal for the sandbox instance, harmless to the host.
 */
public final class RuntimeTrapException extends PackHostException {
    public RuntimeTrapException(String message) {
        super("runtime_trap", message);
    }
}
