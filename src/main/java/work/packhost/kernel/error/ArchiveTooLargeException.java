package work.packhost.kernel.error;

public final class ArchiveTooLargeException extends PackHostException {
    public ArchiveTooLargeException(String message) {
        super("archive_too_large", message);
    }

    @Override
    public boolean securityFailure() {
        return true;
    }
}
