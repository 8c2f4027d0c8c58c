package work.packhost.kernel.install;

import java.util.Optional;
import java.util.regex.Pattern;
import work.packhost.kernel.error.PackHostException;

/**
 * Release artifact naming convention {@code pack-<variant>-<target>-<version>.zip}.
 */
public record PackNaming(String variant, String target, String version, String fileName) {
    private static final Pattern PATTERN = Pattern.compile("^pack-([a-z0-9-]+)-([a-z0-9-]+)-(.+)\\.zip$");
    private static final Pattern SEGMENT = Pattern.compile("[a-z0-9-]+");

    public static Optional<PackNaming> parse(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        var matcher = PATTERN.matcher(fileName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new PackNaming(matcher.group(1), matcher.group(2), matcher.group(3), fileName));
    }

    public static boolean isValid(String fileName) {
        return parse(fileName).isPresent();
    }

    public static PackNaming validateOrThrow(String fileName) {
        return parse(fileName).orElseThrow(() -> new PackHostException("invalid_pack_name",
            "Invalid pack file name: " + fileName + ". Expected pack-<variant>-<target>-<version>.zip"));
    }

    public static String construct(String variant, String target, String version) {
        if (variant == null || !SEGMENT.matcher(variant).matches()) {
            throw new IllegalArgumentException("Invalid variant: " + variant + " (lowercase alphanumerics and hyphens only)");
        }
        if (target == null || !SEGMENT.matcher(target).matches()) {
            throw new IllegalArgumentException("Invalid target: " + target + " (lowercase alphanumerics and hyphens only)");
        }
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Version cannot be blank");
        }
        return "pack-" + variant + "-" + target + "-" + version + ".zip";
    }

    /**
     * Last path segment of a download URL, without query string or fragment.
     */
    public static String fileNameOf(String downloadUrl) {
        var path = downloadUrl;
        int cut = path.indexOf('?');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        cut = path.indexOf('#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
