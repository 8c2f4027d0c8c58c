package work.packhost.kernel.install;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpServer;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.packhost.kernel.error.DownloadFailedException;

class HttpArtifactSourceTest {
    private static final byte[] PAYLOAD = { 'P', 'K', 5, 6, 0, 0 };

    @TempDir
    Path temp;

    private HttpServer server;
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/pack.zip", exchange -> {
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            exchange.sendResponseHeaders(200, PAYLOAD.length);
            exchange.getResponseBody().write(PAYLOAD);
            exchange.close();
        });
        server.createContext("/missing.zip", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void downloadsBodyToDestination() throws Exception {
        var source = new HttpArtifactSource(Duration.ofSeconds(5));
        var destination = temp.resolve("pack.archive");

        source.downloadArtifact(baseUrl() + "/pack.zip", destination);

        assertArrayEquals(PAYLOAD, Files.readAllBytes(destination));
        assertFalse(source.requiresAuthentication());
        assertNull(lastAuthorization.get());
    }

    @Test
    void sendsBearerTokenWhenConfigured() {
        var source = new HttpArtifactSource(Duration.ofSeconds(5), () -> "secret-token");

        source.downloadArtifact(baseUrl() + "/pack.zip", temp.resolve("pack.archive"));

        assertTrue(source.requiresAuthentication());
        assertTrue(source.isAuthenticated());
        assertEquals("Bearer secret-token", lastAuthorization.get());
    }

    @Test
    void blankTokenMeansNotAuthenticated() {
        assertFalse(new HttpArtifactSource(Duration.ofSeconds(5), () -> " ").isAuthenticated());
    }

    @Test
    void httpErrorStatusFailsTheDownload() {
        var source = new HttpArtifactSource(Duration.ofSeconds(5));

        var ex = assertThrows(DownloadFailedException.class,
            () -> source.downloadArtifact(baseUrl() + "/missing.zip", temp.resolve("pack.archive")));

        assertTrue(ex.getMessage().contains("404"));
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }
}
