package work.packhost.kernel.error;

/**
 * Raised when a production install is attempted without an expected archive checksum.
 */
public final class ChecksumRequiredException extends PackHostException {
    public ChecksumRequiredException(String downloadUrl) {
        super("checksum_required", "Checksum required for production installs: " + downloadUrl);
    }
}
