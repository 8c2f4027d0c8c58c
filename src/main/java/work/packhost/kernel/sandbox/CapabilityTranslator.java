package work.packhost.kernel.sandbox;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.packhost.kernel.error.ManifestInvalidException;
import work.packhost.kernel.pack.PackLimits;
import work.packhost.kernel.pack.PackPermissions;

/**
 * Maps declared permissions, env vars and limits onto a {@link CapabilityDescriptor}. Each declared
 * guest path is backed by {@code <sandbox-root>/<packId>/<guestPath>}, so guest paths of different
 * packs never share host directories.
 */
public final class CapabilityTranslator {
    private final Path sandboxRoot;
    private final boolean inheritStdout;
    private final boolean inheritStderr;

    public CapabilityTranslator(Path sandboxRoot, boolean inheritStdout, boolean inheritStderr) {
        this.sandboxRoot = Objects.requireNonNull(sandboxRoot, "sandboxRoot").toAbsolutePath().normalize();
        this.inheritStdout = inheritStdout;
        this.inheritStderr = inheritStderr;
    }

    public Path sandboxRoot() {
        return sandboxRoot;
    }

    public Path packRoot(String packId) {
        return sandboxRoot.resolve(packId);
    }

    public CapabilityDescriptor build(String packId, PackPermissions permissions, Map<String, String> envVars, PackLimits limits) {
        Objects.requireNonNull(packId, "packId");
        Objects.requireNonNull(limits, "limits");
        var declared = permissions == null ? PackPermissions.none() : permissions;
        var packRoot = packRoot(packId);
        var preopens = new LinkedHashMap<String, PreopenDir>();
        for (String path : declared.filesystem().read()) {
            var guest = normalizeGuestPath(path);
            preopens.putIfAbsent(guest, new PreopenDir(guest, hostPath(packRoot, guest), true));
        }
        for (String path : declared.filesystem().write()) {
            var guest = normalizeGuestPath(path);
            preopens.put(guest, new PreopenDir(guest, hostPath(packRoot, guest), false));
        }
        return new CapabilityDescriptor(
            new ArrayList<>(preopens.values()),
            envVars,
            inheritStdout,
            inheritStderr,
            limits.memoryMb(),
            limits.cpuMsPerSec()
        );
    }

    /**
     * Creates the host directory behind every preopen.
     */
    public void prepareHostDirectories(CapabilityDescriptor descriptor) {
        for (PreopenDir dir : descriptor.preopenDirs()) {
            try {
                Files.createDirectories(dir.hostPath());
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to prepare " + dir.hostPath(), ex);
            }
        }
    }

    /**
     * Canonical guest form: forward slashes, no leading {@code ./} or {@code /}, no trailing slash.
     */
    static String normalizeGuestPath(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ManifestInvalidException("Filesystem path cannot be blank");
        }
        var parts = new ArrayList<String>();
        for (String segment : raw.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                throw new ManifestInvalidException("Filesystem paths cannot contain .., got: " + raw);
            }
            parts.add(segment);
        }
        return parts.isEmpty() ? "." : String.join("/", parts);
    }

    private static Path hostPath(Path packRoot, String guest) {
        var host = ".".equals(guest) ? packRoot : packRoot.resolve(guest).normalize();
        if (!host.startsWith(packRoot)) {
            throw new ManifestInvalidException("Filesystem path escapes the pack sandbox: " + guest);
        }
        return host;
    }
}
