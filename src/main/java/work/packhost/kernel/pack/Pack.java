package work.packhost.kernel.pack;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * An installed pack. Never mutated in place; a re-install produces a new record under the same id.
 */
public record Pack(
    String id,
    String name,
    String version,
    PackType type,
    PackManifest manifest,
    InstallSource installSource,
    Path installPath,
    String checksumSha256
) {
    public Pack {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(installSource, "installSource");
        Objects.requireNonNull(installPath, "installPath");
        if (installSource.isProd() && (checksumSha256 == null || checksumSha256.isBlank())) {
            throw new IllegalArgumentException("PROD pack " + id + " must carry a verified checksum");
        }
    }

    public static Pack fromManifest(PackManifest manifest, InstallSource source, Path installPath, String checksum) {
        return new Pack(manifest.id(), manifest.name(), manifest.version(), manifest.type(), manifest, source, installPath, checksum);
    }

    public Path entryPath() {
        return installPath.resolve(manifest.entry());
    }

    public List<String> requiredSecrets() {
        return manifest.requiredEnv();
    }

    public String displayName() {
        return name + " (" + version + ")";
    }
}
