package work.packhost.kernel.install;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.packhost.kernel.shared.FileTrees;

/**
 * On-disk layout of installed packs: {@code <packs>/<packId>} for published trees and a staging
 * directory for in-flight installs. Hidden sibling directories prefixed with {@code .} hold trees
 * being swapped in or out and are never visible under a pack id.
 */
public final class PackStorage {
    private static final Logger log = LoggerFactory.getLogger(PackStorage.class);
    private static final String INCOMING = ".incoming-";
    private static final String RETIRED = ".retired-";

    private final Path packsDirectory;
    private final Path stagingDirectory;

    public PackStorage(Path packsDirectory, Path stagingDirectory) {
        this.packsDirectory = Objects.requireNonNull(packsDirectory, "packsDirectory").toAbsolutePath().normalize();
        this.stagingDirectory = Objects.requireNonNull(stagingDirectory, "stagingDirectory").toAbsolutePath().normalize();
    }

    public Path packsDirectory() {
        return packsDirectory;
    }

    public Path packDirectory(String packId) {
        return packsDirectory.resolve(packId);
    }

    public Path createStagingDirectory() {
        try {
            Files.createDirectories(stagingDirectory);
            return Files.createTempDirectory(stagingDirectory, "install-");
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to create staging directory under " + stagingDirectory, ex);
        }
    }

    /**
     * Moves {@code stagedTree} to {@code <packs>/<packId>}. The new tree is first moved next to its
     * final location, then renamed into place. A previous install is kept aside until the returned
     * publication is committed or rolled back.
     */
    public Publication publish(Path stagedTree, String packId) {
        var target = packDirectory(packId);
        var incoming = packsDirectory.resolve("." + packId + INCOMING + UUID.randomUUID());
        Path retired = null;
        try {
            Files.createDirectories(packsDirectory);
            moveTree(stagedTree, incoming);
            if (Files.exists(target)) {
                retired = packsDirectory.resolve("." + packId + RETIRED + UUID.randomUUID());
                Files.move(target, retired, StandardCopyOption.ATOMIC_MOVE);
            }
            Files.move(incoming, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            if (retired != null && !Files.exists(target)) {
                try {
                    Files.move(retired, target, StandardCopyOption.ATOMIC_MOVE);
                    retired = null;
                } catch (IOException restoreFailure) {
                    ex.addSuppressed(restoreFailure);
                }
            }
            FileTrees.deleteQuietly(incoming);
            throw new UncheckedIOException("Failed to publish pack " + packId, ex);
        }
        log.debug("Published {} to {}", packId, target);
        return new Publication(packId, target, retired);
    }

    public boolean remove(String packId) {
        var target = packDirectory(packId);
        if (!Files.exists(target)) {
            return false;
        }
        try {
            FileTrees.deleteRecursively(target);
            return true;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to remove pack directory " + target, ex);
        }
    }

    /**
     * Removes leftovers of interrupted installs: stale staging trees and hidden swap directories.
     */
    public void sweep() {
        FileTrees.deleteQuietly(stagingDirectory);
        if (!Files.isDirectory(packsDirectory)) {
            return;
        }
        try (var children = Files.list(packsDirectory)) {
            children
                .filter(path -> {
                    var name = path.getFileName().toString();
                    return name.startsWith(".") && (name.contains(INCOMING) || name.contains(RETIRED));
                })
                .forEach(FileTrees::deleteQuietly);
        } catch (IOException ex) {
            log.warn("Failed to sweep {}: {}", packsDirectory, ex.getMessage());
        }
    }

    /**
     * A published tree whose previous install, if any, is still kept aside.
     */
    public static final class Publication {
        private final String packId;
        private final Path path;
        private Path retired;
        private boolean settled;

        private Publication(String packId, Path path, Path retired) {
            this.packId = packId;
            this.path = path;
            this.retired = retired;
        }

        public Path path() {
            return path;
        }

        public boolean replacedPrevious() {
            return retired != null;
        }

        /**
         * Drops the previous install.
         */
        public void commit() {
            if (settled) {
                return;
            }
            settled = true;
            if (retired != null) {
                FileTrees.deleteQuietly(retired);
                retired = null;
            }
        }

        /**
         * Removes the published tree and puts the previous install back in place.
         */
        public void rollback() {
            if (settled) {
                return;
            }
            settled = true;
            try {
                FileTrees.deleteRecursively(path);
                if (retired != null) {
                    Files.move(retired, path, StandardCopyOption.ATOMIC_MOVE);
                    retired = null;
                }
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to restore previous install of " + packId, ex);
            }
            log.debug("Rolled back publication of {}", packId);
        }
    }

    private static void moveTree(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            FileTrees.copyRecursively(source, target);
            FileTrees.deleteRecursively(source);
        }
    }
}
