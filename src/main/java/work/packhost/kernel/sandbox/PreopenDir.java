package work.packhost.kernel.sandbox;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One guest directory granted before execution, backed by a pack-private host directory.
 */
public record PreopenDir(String guestPath, Path hostPath, boolean readonly) {
    public PreopenDir {
        Objects.requireNonNull(guestPath, "guestPath");
        Objects.requireNonNull(hostPath, "hostPath");
    }
}
