package work.packhost.kernel.pack;

import java.util.List;

/**
 * Guest-relative paths the pack may read or write.
 */
public record FilesystemPermissions(List<String> read, List<String> write) {
    public FilesystemPermissions {
        read = read == null ? List.of() : List.copyOf(read);
        write = write == null ? List.of() : List.copyOf(write);
    }

    public static FilesystemPermissions none() {
        return new FilesystemPermissions(List.of(), List.of());
    }
}
