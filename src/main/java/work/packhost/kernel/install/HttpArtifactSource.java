package work.packhost.kernel.install;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.packhost.kernel.error.DownloadFailedException;

/**
 * {@link ArtifactSource} over HTTP(S). When a token supplier is configured the source requires a
 * token and sends it as a bearer credential.
 */
public final class HttpArtifactSource implements ArtifactSource {
    private static final Logger log = LoggerFactory.getLogger(HttpArtifactSource.class);

    private final HttpClient client;
    private final Duration timeout;
    private final Supplier<String> tokenSupplier;

    public HttpArtifactSource(Duration timeout) {
        this(timeout, null);
    }

    public HttpArtifactSource(Duration timeout, Supplier<String> tokenSupplier) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.tokenSupplier = tokenSupplier;
        this.client = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Override
    public void downloadArtifact(String url, Path destination) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException ex) {
            throw new DownloadFailedException("Invalid download URL: " + url, ex);
        }
        var request = HttpRequest.newBuilder(uri).timeout(timeout).GET();
        var token = currentToken();
        if (token != null) {
            request.header("Authorization", "Bearer " + token);
        }
        try {
            log.debug("Downloading {}", uri);
            var response = client.send(request.build(), HttpResponse.BodyHandlers.ofInputStream());
            try (var body = response.body()) {
                if (response.statusCode() >= 400) {
                    throw new DownloadFailedException("HTTP " + response.statusCode() + " while downloading " + url);
                }
                Files.copy(body, destination, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Downloaded {} ({} bytes)", destination.getFileName(), Files.size(destination));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DownloadFailedException("Interrupted while downloading " + url, ex);
        } catch (IOException ex) {
            throw new DownloadFailedException("Failed to download " + url + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public boolean isAuthenticated() {
        return currentToken() != null;
    }

    @Override
    public boolean requiresAuthentication() {
        return tokenSupplier != null;
    }

    private String currentToken() {
        if (tokenSupplier == null) {
            return null;
        }
        var token = tokenSupplier.get();
        return token == null || token.isBlank() ? null : token;
    }
}
