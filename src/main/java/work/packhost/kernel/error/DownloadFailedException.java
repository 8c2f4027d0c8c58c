package work.packhost.kernel.error;

public final class DownloadFailedException extends PackHostException {
    public DownloadFailedException(String message) {
        super("download_failed", message);
    }

    public DownloadFailedException(String message, Throwable cause) {
        super("download_failed", message, null, cause);
    }
}
