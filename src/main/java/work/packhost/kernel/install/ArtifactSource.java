package work.packhost.kernel.install;

import java.nio.file.Path;

/**
 * Fetches pack archives. Implementations report failures with
 * {@link work.packhost.kernel.error.DownloadFailedException}.
 */
public interface ArtifactSource {
    void downloadArtifact(String url, Path destination);

    boolean isAuthenticated();

    /**
     * Whether {@link #isAuthenticated()} must hold before a download is attempted.
     */
    default boolean requiresAuthentication() {
        return false;
    }
}
