package work.packhost.kernel.sandbox;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.packhost.kernel.error.CapabilityDeniedException;
import work.packhost.kernel.error.ManifestInvalidException;
import work.packhost.kernel.error.NetworkCapabilityDeniedException;
import work.packhost.kernel.pack.PackPermissions;

/**
 * Runtime gatekeeper for capability-sensitive operations. Everything is denied unless a declared
 * permission covers it.
 *
 * <p>Outbound connections are allowed when some {@code network.connect} entry has the same scheme,
 * host (case-insensitive) and effective port as the request, and the request path equals the entry
 * path or continues it after a {@code /}. Query strings and fragments play no part in matching.</p>
 */
public final class PermissionEnforcer {
    private static final Logger log = LoggerFactory.getLogger(PermissionEnforcer.class);
    private static final Set<String> LOOPBACK_NAMES = Set.of("localhost", "::1", "[::1]", "0:0:0:0:0:0:0:1");
    // %2e, %2f and %5c: a decoding server could turn these into dot segments or separators
    private static final Pattern ENCODED_SEGMENT = Pattern.compile("%(2e|2f|5c)", Pattern.CASE_INSENSITIVE);

    public void validateManifest(String packId, PackPermissions permissions) {
        var declared = permissions == null ? PackPermissions.none() : permissions;
        for (String path : declared.filesystem().read()) {
            validatePath(packId, path);
        }
        for (String path : declared.filesystem().write()) {
            validatePath(packId, path);
        }
        for (String url : declared.network().connect()) {
            parseAllowEntry(url);
        }
    }

    public void checkConnect(String packId, PackPermissions permissions, URI target) {
        if (target == null) {
            throw new NetworkCapabilityDeniedException(packId, "null");
        }
        var request = target.normalize();
        var scheme = request.getScheme() == null ? "" : request.getScheme().toLowerCase(Locale.ROOT);
        if (!("http".equals(scheme) || "https".equals(scheme)) || request.getHost() == null) {
            deny(packId, target);
        }
        var declared = permissions == null ? PackPermissions.none() : permissions;
        for (String entry : declared.network().connect()) {
            URI allowed;
            try {
                allowed = parseAllowEntry(entry);
            } catch (ManifestInvalidException ex) {
                continue;
            }
            if (covers(allowed, request)) {
                log.trace("Pack {} connect to {} allowed by {}", packId, target, entry);
                return;
            }
        }
        deny(packId, target);
    }

    public void checkConnect(String packId, PackPermissions permissions, String url) {
        URI target;
        try {
            target = new URI(url);
        } catch (URISyntaxException | NullPointerException ex) {
            throw new NetworkCapabilityDeniedException(packId, String.valueOf(url));
        }
        checkConnect(packId, permissions, target);
    }

    /**
     * Binding is limited to loopback addresses and requires {@code listen_localhost}.
     */
    public void checkListen(String packId, PackPermissions permissions, String host, int port) {
        var declared = permissions == null ? PackPermissions.none() : permissions;
        if (!declared.network().listenLocalhost() || !isLoopback(host) || port < 0 || port > 65_535) {
            log.warn("Pack {} denied listen on {}:{}", packId, host, port);
            throw new CapabilityDeniedException("listen_capability_denied",
                "Pack " + packId + " is not allowed to listen on " + host + ":" + port,
                Map.of("packId", packId, "host", String.valueOf(host), "port", port));
        }
    }

    /**
     * @return the host path backing {@code guestPath}
     */
    public Path checkFileAccess(String packId, CapabilityDescriptor descriptor, String guestPath, boolean write) {
        String normalized;
        try {
            normalized = CapabilityTranslator.normalizeGuestPath(guestPath);
        } catch (ManifestInvalidException ex) {
            throw fileDenied(packId, guestPath, write);
        }
        for (PreopenDir dir : descriptor.preopenDirs()) {
            var root = dir.guestPath();
            boolean inside = ".".equals(root) || normalized.equals(root) || normalized.startsWith(root + "/");
            if (!inside) {
                continue;
            }
            if (write && dir.readonly()) {
                continue;
            }
            var relative = ".".equals(root) || normalized.equals(root) ? "" : normalized.substring(root.length() + 1);
            return relative.isEmpty() ? dir.hostPath() : dir.hostPath().resolve(relative).normalize();
        }
        throw fileDenied(packId, guestPath, write);
    }

    static boolean covers(URI allowed, URI request) {
        if (!allowed.getScheme().equalsIgnoreCase(request.getScheme())) {
            return false;
        }
        if (!allowed.getHost().equalsIgnoreCase(request.getHost())) {
            return false;
        }
        if (effectivePort(allowed) != effectivePort(request)) {
            return false;
        }
        var allowedPath = pathOf(allowed);
        var requestPath = pathOf(request);
        if ("/".equals(allowedPath) || requestPath.equals(allowedPath)) {
            return true;
        }
        if (ENCODED_SEGMENT.matcher(requestPath).find()) {
            return false;
        }
        var prefix = allowedPath.endsWith("/") ? allowedPath : allowedPath + "/";
        return requestPath.startsWith(prefix);
    }

    private static URI parseAllowEntry(String url) {
        if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
            throw new ManifestInvalidException("Network connect URLs must start with http:// or https://, got: " + url);
        }
        try {
            var uri = new URI(url).normalize();
            if (uri.getHost() == null) {
                throw new ManifestInvalidException("Network connect URL has no host: " + url);
            }
            return uri;
        } catch (URISyntaxException ex) {
            throw new ManifestInvalidException("Malformed network connect URL: " + url, ex);
        }
    }

    private static void validatePath(String packId, String path) {
        if (path == null || path.isBlank()) {
            throw new ManifestInvalidException("Pack " + packId + " declares a blank filesystem path");
        }
        if (path.startsWith("/") || path.startsWith("\\") || path.matches("^[A-Za-z]:.*")) {
            throw new ManifestInvalidException("Filesystem paths must be relative, got: " + path);
        }
        if (path.contains("..")) {
            throw new ManifestInvalidException("Filesystem paths cannot contain .., got: " + path);
        }
    }

    private static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    private static String pathOf(URI uri) {
        var path = uri.getRawPath();
        return path == null || path.isEmpty() ? "/" : path;
    }

    private static boolean isLoopback(String host) {
        if (host == null) {
            return false;
        }
        var normalized = host.trim().toLowerCase(Locale.ROOT);
        return LOOPBACK_NAMES.contains(normalized) || normalized.matches("^127(\\.\\d{1,3}){3}$");
    }

    private static void deny(String packId, URI target) {
        log.warn("Pack {} denied connect to {}", packId, target);
        throw new NetworkCapabilityDeniedException(packId, target.toString());
    }

    private static CapabilityDeniedException fileDenied(String packId, String guestPath, boolean write) {
        log.warn("Pack {} denied {} access to {}", packId, write ? "write" : "read", guestPath);
        return new CapabilityDeniedException("filesystem_capability_denied",
            "Pack " + packId + " is not allowed to " + (write ? "write" : "read") + " " + guestPath,
            Map.of("packId", packId, "path", String.valueOf(guestPath), "write", write));
    }
}
