package work.packhost.kernel.install;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.packhost.kernel.error.ChecksumMismatchException;
import work.packhost.kernel.error.ChecksumRequiredException;
import work.packhost.kernel.error.NotAuthenticatedException;
import work.packhost.kernel.error.ZipSlipViolationException;
import work.packhost.kernel.pack.InMemoryPackRepository;
import work.packhost.kernel.pack.InstallMode;
import work.packhost.kernel.pack.InstallSource;
import work.packhost.kernel.pack.Pack;
import work.packhost.kernel.pack.PackRepository;
import work.packhost.kernel.pack.PackType;
import work.packhost.kernel.sandbox.PermissionEnforcer;
import work.packhost.kernel.support.PackArchives;

class PackInstallerTest {
    private static final String URL = "https://artifacts.example.com/releases/pack-demo-wasm32-1.0.0.zip";

    @TempDir
    Path temp;

    private MapArtifactSource artifacts;
    private InMemoryPackRepository repository;
    private PackStorage storage;
    private PackInstaller installer;

    @BeforeEach
    void setUp() {
        artifacts = new MapArtifactSource();
        repository = new InMemoryPackRepository();
        storage = new PackStorage(temp.resolve("packs"), temp.resolve("staging"));
        installer = new PackInstaller(storage, artifacts, repository, new ArchiveExtractor(), new PermissionEnforcer(), false);
    }

    @Test
    void prodInstallWithoutChecksumFailsBeforeDownload() {
        var result = installer.installFromUrl(URL, InstallSource.prod("v1", URL), null);

        assertTrue(result.isFailure());
        assertInstanceOf(ChecksumRequiredException.class, result.error());
        assertEquals(0, artifacts.downloads.get());
        assertTrue(repository.list().isEmpty());
    }

    @Test
    void prodInstallWithWrongChecksumPersistsNothing() throws Exception {
        artifacts.publish(URL, PackArchives.wasmPack("demo").writeZip(temp.resolve("src/demo.zip")));

        var result = installer.installFromUrl(URL, InstallSource.prod("v1", URL), "f".repeat(64));

        assertTrue(result.isFailure());
        var mismatch = assertInstanceOf(ChecksumMismatchException.class, result.error());
        assertEquals("f".repeat(64), mismatch.expected());
        assertTrue(repository.getById("demo").isEmpty());
        assertFalse(Files.exists(temp.resolve("packs/demo")));
        assertNoStagingLeftovers();
    }

    @Test
    void prodInstallWithMatchingChecksumPublishesPack() throws Exception {
        var archive = PackArchives.wasmPack("demo", "API_KEY").writeZip(temp.resolve("src/demo.zip"));
        artifacts.publish(URL, archive);
        var digest = ChecksumVerifier.sha256(archive);

        var result = installer.installFromUrl(URL, InstallSource.prod("v1", URL), digest.toUpperCase());

        assertTrue(result.isSuccess(), () -> String.valueOf(result.error()));
        Pack pack = result.value();
        assertEquals("demo", pack.id());
        assertEquals(PackType.WASM, pack.type());
        assertEquals(InstallMode.PROD, pack.installSource().mode());
        assertEquals(digest, pack.checksumSha256());
        assertEquals(List.of("API_KEY"), pack.requiredSecrets());
        assertTrue(Files.isRegularFile(pack.entryPath()));
        assertEquals(pack, repository.getById("demo").orElseThrow());
        assertNoStagingLeftovers();
    }

    @Test
    void devInstallRecordsComputedChecksum() throws Exception {
        var archive = PackArchives.wasmPack("demo").writeZip(temp.resolve("src/demo.zip"));
        artifacts.publish(URL, archive);

        var pack = installer.installFromUrl(URL, InstallSource.dev("local", URL), null).getOrThrow();

        assertEquals(ChecksumVerifier.sha256(archive), pack.checksumSha256());
    }

    @Test
    void zipSlipArchiveInstallsNothing() throws Exception {
        var archive = PackArchives.wasmPack("demo")
            .file("../../outside.txt", "x")
            .writeZip(temp.resolve("src/slip.zip"));
        artifacts.publish(URL, archive);

        var result = installer.installFromUrl(URL, InstallSource.dev("local", URL), null);

        assertInstanceOf(ZipSlipViolationException.class, result.error());
        assertTrue(repository.list().isEmpty());
        assertFalse(Files.exists(temp.resolve("packs/demo")));
        assertNoStagingLeftovers();
    }

    @Test
    void reinstallReplacesFilesWithoutOrphans() throws Exception {
        var first = PackArchives.wasmPack("demo")
            .file("data/old.txt", "old")
            .writeZip(temp.resolve("src/v1.zip"));
        var second = PackArchives.wasmPack("demo")
            .file("data/new.txt", "new")
            .writeZip(temp.resolve("src/v2.zip"));

        installer.installFromFile(first, InstallSource.dev("v1", first.toString()), null).getOrThrow();
        var pack = installer.installFromFile(second, InstallSource.dev("v2", second.toString()), null).getOrThrow();

        assertTrue(Files.exists(pack.installPath().resolve("data/new.txt")));
        assertFalse(Files.exists(pack.installPath().resolve("data/old.txt")));
        try (Stream<Path> children = Files.list(temp.resolve("packs"))) {
            assertEquals(List.of("demo"), children.map(path -> path.getFileName().toString()).toList());
        }
        assertEquals(1, repository.list().size());
        assertEquals("v2", repository.getById("demo").orElseThrow().installSource().sourceRef());
    }

    @Test
    void missingEntryFileIsRejected() throws Exception {
        var archive = PackArchives.builder()
            .file("pack.json", PackArchives.wasmManifest("demo"))
            .writeZip(temp.resolve("src/noentry.zip"));

        var result = installer.installFromFile(archive, InstallSource.dev("x", archive.toString()), null);

        assertEquals("manifest_invalid", result.errorCode());
        assertFalse(Files.exists(temp.resolve("packs/demo")));
    }

    @Test
    void tamperedSidecarEntryAbortsInstall() throws Exception {
        var archive = PackArchives.wasmPack("demo")
            .file("checksums.sha256", "0000000000000000000000000000000000000000000000000000000000000000  module.wasm\n")
            .writeZip(temp.resolve("src/sidecar.zip"));

        var result = installer.installFromFile(archive, InstallSource.dev("x", archive.toString()), null);

        assertInstanceOf(ChecksumMismatchException.class, result.error());
        assertTrue(repository.list().isEmpty());
    }

    @Test
    void namingConventionIsEnforcedWhenEnabled() throws Exception {
        var strict = new PackInstaller(storage, artifacts, repository, new ArchiveExtractor(), new PermissionEnforcer(), true);
        var archive = PackArchives.wasmPack("demo").writeZip(temp.resolve("src/demo.zip"));

        var result = strict.installFromFile(archive, InstallSource.dev("x", archive.toString()), null);

        assertEquals("invalid_pack_name", result.errorCode());
    }

    @Test
    void unauthenticatedSourceIsRefused() throws Exception {
        artifacts.requiresAuth = true;
        artifacts.publish(URL, PackArchives.wasmPack("demo").writeZip(temp.resolve("src/demo.zip")));

        var result = installer.installFromUrl(URL, InstallSource.dev("x", URL), null);

        assertInstanceOf(NotAuthenticatedException.class, result.error());
        assertEquals(0, artifacts.downloads.get());
    }

    @Test
    void failedRepositoryInsertRemovesPublishedFiles() throws Exception {
        var failing = new PackRepository() {
            @Override
            public void insert(Pack pack) {
                throw new IllegalStateException("database offline");
            }

            @Override
            public Optional<Pack> getById(String packId) {
                return Optional.empty();
            }

            @Override
            public boolean delete(String packId) {
                return false;
            }

            @Override
            public List<Pack> list() {
                return List.of();
            }
        };
        var installerWithFailingRepo = new PackInstaller(storage, artifacts, failing, new ArchiveExtractor(), new PermissionEnforcer(), false);
        var archive = PackArchives.wasmPack("demo").writeZip(temp.resolve("src/demo.zip"));

        var result = installerWithFailingRepo.installFromFile(archive, InstallSource.dev("x", archive.toString()), null);

        assertTrue(result.isFailure());
        assertFalse(Files.exists(temp.resolve("packs/demo")));
        assertNoStagingLeftovers();
    }

    @Test
    void failedReinstallKeepsPreviousInstall() throws Exception {
        var inserts = new AtomicInteger();
        var flaky = new PackRepository() {
            @Override
            public void insert(Pack pack) {
                if (inserts.incrementAndGet() > 1) {
                    throw new IllegalStateException("database offline");
                }
                repository.insert(pack);
            }

            @Override
            public Optional<Pack> getById(String packId) {
                return repository.getById(packId);
            }

            @Override
            public boolean delete(String packId) {
                return repository.delete(packId);
            }

            @Override
            public List<Pack> list() {
                return repository.list();
            }
        };
        var flakyInstaller = new PackInstaller(storage, artifacts, flaky, new ArchiveExtractor(), new PermissionEnforcer(), false);
        var first = PackArchives.wasmPack("demo")
            .file("data/old.txt", "old")
            .writeZip(temp.resolve("src/v1.zip"));
        var second = PackArchives.wasmPack("demo")
            .file("data/new.txt", "new")
            .writeZip(temp.resolve("src/v2.zip"));
        flakyInstaller.installFromFile(first, InstallSource.dev("v1", first.toString()), null).getOrThrow();

        var result = flakyInstaller.installFromFile(second, InstallSource.dev("v2", second.toString()), null);

        assertTrue(result.isFailure());
        assertEquals("v1", repository.getById("demo").orElseThrow().installSource().sourceRef());
        assertEquals("old", Files.readString(temp.resolve("packs/demo/data/old.txt")));
        assertFalse(Files.exists(temp.resolve("packs/demo/data/new.txt")));
        try (Stream<Path> children = Files.list(temp.resolve("packs"))) {
            assertEquals(List.of("demo"), children.map(path -> path.getFileName().toString()).toList());
        }
        assertNoStagingLeftovers();
    }

    @Test
    void uninstallRemovesFilesAndRecord() throws Exception {
        var archive = PackArchives.wasmPack("demo").writeZip(temp.resolve("src/demo.zip"));
        installer.installFromFile(archive, InstallSource.dev("x", archive.toString()), null).getOrThrow();

        var removed = installer.uninstall("demo");

        assertNotNull(removed.value());
        assertFalse(Files.exists(temp.resolve("packs/demo")));
        assertTrue(repository.getById("demo").isEmpty());
        assertEquals("pack_not_found", installer.uninstall("demo").errorCode());
    }

    private void assertNoStagingLeftovers() throws IOException {
        var staging = temp.resolve("staging");
        if (!Files.exists(staging)) {
            return;
        }
        try (Stream<Path> children = Files.list(staging)) {
            assertEquals(0, children.count(), "staging must be empty");
        }
    }

    private static final class MapArtifactSource implements ArtifactSource {
        private final Map<String, Path> artifacts = new HashMap<>();
        private final AtomicInteger downloads = new AtomicInteger();
        private boolean requiresAuth;

        void publish(String url, Path archive) {
            artifacts.put(url, archive);
        }

        @Override
        public void downloadArtifact(String url, Path destination) {
            downloads.incrementAndGet();
            try {
                Files.copy(artifacts.get(url), destination);
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        }

        @Override
        public boolean isAuthenticated() {
            return false;
        }

        @Override
        public boolean requiresAuthentication() {
            return requiresAuth;
        }
    }
}
