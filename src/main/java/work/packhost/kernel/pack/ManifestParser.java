package work.packhost.kernel.pack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import work.packhost.kernel.error.ManifestInvalidException;
import work.packhost.kernel.shared.Json;

/**
 * Reads {@code pack.json} into a {@link PackManifest} and applies the structural checks:
 * required fields, entry suffix matching the pack type and positive limits. Permission
 * entries are validated separately by the permission enforcer.
 */
public final class ManifestParser {
    public static final String MANIFEST_FILE = "pack.json";
    private static final Pattern PACK_ID = Pattern.compile("^[a-z0-9][a-z0-9._-]*$");

    private ManifestParser() {}

    public static PackManifest parse(Path manifestFile) {
        try {
            return parse(Files.readString(manifestFile));
        } catch (NoSuchFileException ex) {
            throw new ManifestInvalidException(MANIFEST_FILE + " not found at archive root", ex);
        } catch (IOException ex) {
            throw new ManifestInvalidException("Failed to read " + manifestFile + ": " + ex.getMessage(), ex);
        }
    }

    public static PackManifest parse(String json) {
        JsonNode root;
        try {
            root = Json.mapper().readTree(json);
        } catch (JsonProcessingException ex) {
            throw new ManifestInvalidException("Malformed " + MANIFEST_FILE + ": " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new ManifestInvalidException(MANIFEST_FILE + " must be a JSON object");
        }
        PackType type;
        try {
            type = PackType.from(text(root, "type"));
        } catch (IllegalArgumentException ex) {
            throw new ManifestInvalidException(ex.getMessage(), ex);
        }
        var manifest = new PackManifest(
            root.path("pack_version").asInt(1),
            text(root, "id"),
            text(root, "name"),
            text(root, "version"),
            type,
            text(root, "entry"),
            permissions(root.path("permissions")),
            limits(root.get("limits")),
            strings(root.path("required_env"), "required_env"),
            build(root.path("build"))
        );
        validate(manifest);
        return manifest;
    }

    public static void validate(PackManifest manifest) {
        requireNonBlank(manifest.id(), "Pack id");
        requireNonBlank(manifest.name(), "Pack name");
        requireNonBlank(manifest.version(), "Pack version");
        requireNonBlank(manifest.entry(), "Entry point");
        if (!PACK_ID.matcher(manifest.id()).matches()) {
            throw new ManifestInvalidException("Pack id must match [a-z0-9][a-z0-9._-]*, got: " + manifest.id());
        }
        var entry = manifest.entry().toLowerCase(Locale.ROOT);
        switch (manifest.type()) {
            case WASM -> {
                if (!entry.endsWith(".wasm")) {
                    throw new ManifestInvalidException("WASM pack entry must end with .wasm, got: " + manifest.entry());
                }
            }
            case WORKFLOW -> {
                if (!(entry.endsWith(".json") || entry.endsWith(".yaml") || entry.endsWith(".yml"))) {
                    throw new ManifestInvalidException("Workflow pack entry must end with .json, .yaml or .yml, got: " + manifest.entry());
                }
            }
        }
        if (manifest.entry().startsWith("/") || manifest.entry().contains("..")) {
            throw new ManifestInvalidException("Entry point must be a relative path inside the pack, got: " + manifest.entry());
        }
        if (manifest.limits().memoryMb() <= 0) {
            throw new ManifestInvalidException("Memory limit must be positive");
        }
        if (manifest.limits().cpuMsPerSec() <= 0) {
            throw new ManifestInvalidException("CPU limit must be positive");
        }
    }

    private static PackPermissions permissions(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return PackPermissions.none();
        }
        var network = node.path("network");
        var filesystem = node.path("filesystem");
        return new PackPermissions(
            new NetworkPermissions(
                strings(network.path("connect"), "permissions.network.connect"),
                network.path("listen_localhost").asBoolean(false)),
            new FilesystemPermissions(
                strings(filesystem.path("read"), "permissions.filesystem.read"),
                strings(filesystem.path("write"), "permissions.filesystem.write"))
        );
    }

    private static PackLimits limits(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ManifestInvalidException("limits is required");
        }
        var memory = node.get("memory_mb");
        var cpu = node.get("cpu_ms_per_sec");
        if (memory == null || !memory.canConvertToInt() || cpu == null || !cpu.canConvertToInt()) {
            throw new ManifestInvalidException("limits.memory_mb and limits.cpu_ms_per_sec must be integers");
        }
        return new PackLimits(memory.asInt(), cpu.asInt());
    }

    private static BuildMetadata build(JsonNode node) {
        if (!node.isObject()) {
            return BuildMetadata.unknown();
        }
        return new BuildMetadata(node.path("git_sha").asText(""), node.path("built_at").asText(""), node.path("target").asText(""));
    }

    private static List<String> strings(JsonNode node, String field) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ManifestInvalidException(field + " must be an array of strings");
        }
        var values = new ArrayList<String>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new ManifestInvalidException(field + " must be an array of strings");
            }
            values.add(item.asText());
        }
        return values;
    }

    private static String text(JsonNode root, String field) {
        var node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static void requireNonBlank(String value, String label) {
        if (value == null || value.isBlank()) {
            throw new ManifestInvalidException(label + " cannot be blank");
        }
    }
}
