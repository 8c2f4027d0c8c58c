package work.packhost.kernel.pack;

import java.util.List;
import java.util.Objects;

/**
 * Parsed {@code pack.json}. Built by {@link ManifestParser}, which also performs the structural checks.
 */
public record PackManifest(
    int packVersion,
    String id,
    String name,
    String version,
    PackType type,
    String entry,
    PackPermissions permissions,
    PackLimits limits,
    List<String> requiredEnv,
    BuildMetadata build
) {
    public PackManifest {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(limits, "limits");
        permissions = permissions == null ? PackPermissions.none() : permissions;
        requiredEnv = requiredEnv == null ? List.of() : List.copyOf(requiredEnv);
        build = build == null ? BuildMetadata.unknown() : build;
    }
}
