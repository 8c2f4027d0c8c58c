package work.packhost.kernel.pack;

import java.time.Instant;
import java.util.Objects;

/**
 * Where an installed pack came from.
 *
 * @param sourceRef free-form reference such as a branch, tag or local file name
 */
public record InstallSource(InstallMode mode, String sourceRef, String sourceUrl, Instant installedAt) {
    public InstallSource {
        Objects.requireNonNull(mode, "mode");
        installedAt = installedAt == null ? Instant.now() : installedAt;
    }

    public static InstallSource dev(String sourceRef, String sourceUrl) {
        return new InstallSource(InstallMode.DEV, sourceRef, sourceUrl, Instant.now());
    }

    public static InstallSource prod(String sourceRef, String sourceUrl) {
        return new InstallSource(InstallMode.PROD, sourceRef, sourceUrl, Instant.now());
    }

    public boolean isProd() {
        return mode == InstallMode.PROD;
    }
}
