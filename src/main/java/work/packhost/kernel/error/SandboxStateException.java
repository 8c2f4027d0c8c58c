package work.packhost.kernel.error;

public final class SandboxStateException extends PackHostException {
    public SandboxStateException(String message) {
        super("sandbox_state", message);
    }
}
