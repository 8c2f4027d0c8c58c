package work.packhost.kernel.error;

public final class ManifestInvalidException extends PackHostException {
    public ManifestInvalidException(String message) {
        super("manifest_invalid", message);
    }

    public ManifestInvalidException(String message, Throwable cause) {
        super("manifest_invalid", message, null, cause);
    }
}
