package work.packhost.kernel.install;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.packhost.kernel.api.Result;
import work.packhost.kernel.error.ChecksumMismatchException;
import work.packhost.kernel.error.ChecksumRequiredException;
import work.packhost.kernel.error.ManifestInvalidException;
import work.packhost.kernel.error.NotAuthenticatedException;
import work.packhost.kernel.error.PackNotFoundException;
import work.packhost.kernel.pack.InstallSource;
import work.packhost.kernel.pack.ManifestParser;
import work.packhost.kernel.pack.Pack;
import work.packhost.kernel.pack.PackRepository;
import work.packhost.kernel.sandbox.PermissionEnforcer;
import work.packhost.kernel.shared.FileTrees;

/**
 * Download, verify, extract, validate and publish pipeline for packs. Every failure removes the
 * staging tree; nothing becomes visible under {@code <packs>/<packId>} or in the repository
 * unless the whole pipeline succeeded.
 */
public final class PackInstaller {
    private static final Logger log = LoggerFactory.getLogger(PackInstaller.class);
    private static final String ARCHIVE_FILE = "pack.archive";
    private static final String EXTRACTED_DIR = "extracted";

    private final PackStorage storage;
    private final ArtifactSource artifactSource;
    private final PackRepository repository;
    private final ArchiveExtractor extractor;
    private final PermissionEnforcer permissionEnforcer;
    private final boolean enforceNaming;

    public PackInstaller(
        PackStorage storage,
        ArtifactSource artifactSource,
        PackRepository repository,
        ArchiveExtractor extractor,
        PermissionEnforcer permissionEnforcer,
        boolean enforceNaming
    ) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.artifactSource = Objects.requireNonNull(artifactSource, "artifactSource");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.permissionEnforcer = Objects.requireNonNull(permissionEnforcer, "permissionEnforcer");
        this.enforceNaming = enforceNaming;
    }

    public Result<Pack> installFromUrl(String downloadUrl, InstallSource installSource, String expectedChecksum) {
        return Result.capture(() -> {
            Objects.requireNonNull(downloadUrl, "downloadUrl");
            Objects.requireNonNull(installSource, "installSource");
            requireChecksumForProd(installSource, expectedChecksum, downloadUrl);
            if (artifactSource.requiresAuthentication() && !artifactSource.isAuthenticated()) {
                throw new NotAuthenticatedException("Artifact source requires authentication before downloading " + downloadUrl);
            }
            if (enforceNaming) {
                PackNaming.validateOrThrow(PackNaming.fileNameOf(downloadUrl));
            }
            log.info("Installing pack from {} ({})", downloadUrl, installSource.mode());
            var staging = storage.createStagingDirectory();
            try {
                var archive = staging.resolve(ARCHIVE_FILE);
                artifactSource.downloadArtifact(downloadUrl, archive);
                return installStaged(archive, staging, installSource, expectedChecksum);
            } finally {
                FileTrees.deleteQuietly(staging);
            }
        });
    }

    public Result<Pack> installFromFile(Path archiveFile, InstallSource installSource, String expectedChecksum) {
        return Result.capture(() -> {
            Objects.requireNonNull(archiveFile, "archiveFile");
            Objects.requireNonNull(installSource, "installSource");
            requireChecksumForProd(installSource, expectedChecksum, archiveFile.toString());
            if (enforceNaming) {
                PackNaming.validateOrThrow(String.valueOf(archiveFile.getFileName()));
            }
            log.info("Installing pack from file {} ({})", archiveFile, installSource.mode());
            var staging = storage.createStagingDirectory();
            try {
                var archive = staging.resolve(ARCHIVE_FILE);
                Files.copy(archiveFile, archive);
                return installStaged(archive, staging, installSource, expectedChecksum);
            } finally {
                FileTrees.deleteQuietly(staging);
            }
        });
    }

    /**
     * Removes the pack's files and its repository record.
     */
    public Result<Pack> uninstall(String packId) {
        return Result.capture(() -> {
            var pack = repository.getById(packId).orElseThrow(() -> new PackNotFoundException(packId));
            storage.remove(packId);
            repository.delete(packId);
            log.info("Uninstalled pack {}", packId);
            return pack;
        });
    }

    private Pack installStaged(Path archive, Path staging, InstallSource source, String expectedChecksum) throws IOException {
        var actual = ChecksumVerifier.sha256(archive);
        if (expectedChecksum != null && !expectedChecksum.isBlank()) {
            if (!ChecksumVerifier.matches(actual, expectedChecksum)) {
                log.error("Checksum mismatch for {}: expected {}, actual {}", source.sourceUrl(), expectedChecksum, actual);
                deleteArchive(archive);
                throw new ChecksumMismatchException("pack archive", expectedChecksum, actual);
            }
            log.debug("Archive checksum verified");
        }

        var extracted = staging.resolve(EXTRACTED_DIR);
        extractor.extract(archive, extracted);

        var manifest = ManifestParser.parse(extracted.resolve(ManifestParser.MANIFEST_FILE));
        permissionEnforcer.validateManifest(manifest.id(), manifest.permissions());
        var entryFile = extracted.resolve(manifest.entry());
        FileTrees.requireInside(extracted, entryFile, manifest.entry());
        if (!Files.isRegularFile(entryFile)) {
            throw new ManifestInvalidException("Entry file not found: " + manifest.entry());
        }
        var sidecar = extracted.resolve(ChecksumManifest.FILE_NAME);
        if (Files.isRegularFile(sidecar)) {
            ChecksumManifest.read(sidecar).verifyEntries(extracted);
            log.debug("Verified {} for {}", ChecksumManifest.FILE_NAME, manifest.id());
        }

        var previous = repository.getById(manifest.id());
        var publication = storage.publish(extracted, manifest.id());
        var installPath = publication.path();
        var pack = Pack.fromManifest(manifest, source, installPath, actual);
        try {
            repository.insert(pack);
        } catch (RuntimeException ex) {
            log.error("Failed to record pack {}; restoring previous state", manifest.id(), ex);
            try {
                publication.rollback();
                if (previous.isEmpty()) {
                    repository.delete(manifest.id());
                }
            } catch (RuntimeException cleanupFailure) {
                ex.addSuppressed(cleanupFailure);
            }
            throw ex;
        }
        publication.commit();
        log.info("Installed pack {} [{}] at {}", pack.displayName(), pack.id(), installPath);
        return pack;
    }

    private static void requireChecksumForProd(InstallSource source, String expectedChecksum, String subject) {
        if (source.isProd() && (expectedChecksum == null || expectedChecksum.isBlank())) {
            throw new ChecksumRequiredException(subject);
        }
    }

    private static void deleteArchive(Path archive) {
        try {
            Files.deleteIfExists(archive);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to delete rejected archive " + archive, ex);
        }
    }
}
