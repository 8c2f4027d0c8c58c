package work.packhost.kernel.error;

public final class SandboxUnavailableException extends PackHostException {
    public SandboxUnavailableException(String message) {
        super("sandbox_unavailable", message);
    }
}
