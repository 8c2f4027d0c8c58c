package work.packhost.kernel.install;

/**
 * Upper bounds applied while extracting an archive.
 *
 * @param maxEntries maximum number of entries, directories included
 * @param maxTotalBytes maximum number of uncompressed bytes written
 */
public record ArchiveLimits(int maxEntries, long maxTotalBytes) {
    public static final int DEFAULT_MAX_ENTRIES = 10_000;
    public static final long DEFAULT_MAX_TOTAL_BYTES = 512L * 1024 * 1024;

    public ArchiveLimits {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        if (maxTotalBytes <= 0) {
            throw new IllegalArgumentException("maxTotalBytes must be positive");
        }
    }

    public static ArchiveLimits defaults() {
        return new ArchiveLimits(DEFAULT_MAX_ENTRIES, DEFAULT_MAX_TOTAL_BYTES);
    }
}
