package work.packhost.kernel.sandbox;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.packhost.kernel.error.ManifestInvalidException;
import work.packhost.kernel.pack.FilesystemPermissions;
import work.packhost.kernel.pack.NetworkPermissions;
import work.packhost.kernel.pack.PackLimits;
import work.packhost.kernel.pack.PackPermissions;
import work.packhost.kernel.shared.Json;

class CapabilityTranslatorTest {
    @TempDir
    Path sandboxRoot;

    @Test
    void mapsOnlyDeclaredPathsUnderThePackRoot() {
        var translator = new CapabilityTranslator(sandboxRoot, true, false);
        var permissions = new PackPermissions(
            NetworkPermissions.none(),
            new FilesystemPermissions(List.of("data", "./shared/"), List.of("cache"))
        );

        var descriptor = translator.build("weather", permissions, Map.of("API_KEY", "k"), new PackLimits(64, 500));

        assertEquals(3, descriptor.preopenDirs().size());
        var data = descriptor.preopen("data").orElseThrow();
        assertTrue(data.readonly());
        assertEquals(sandboxRoot.resolve("weather/data"), data.hostPath());
        assertEquals("shared", descriptor.preopen("shared").orElseThrow().guestPath());
        assertFalse(descriptor.preopen("cache").orElseThrow().readonly());
        for (PreopenDir dir : descriptor.preopenDirs()) {
            assertTrue(dir.hostPath().startsWith(sandboxRoot.resolve("weather")));
        }
        assertEquals(Map.of("API_KEY", "k"), descriptor.envVars());
        assertEquals(64, descriptor.memoryLimitMb());
        assertEquals(500, descriptor.cpuLimitMsPerSec());
        assertTrue(descriptor.inheritStdout());
        assertFalse(descriptor.inheritStderr());
    }

    @Test
    void pathDeclaredForReadAndWriteYieldsOneWritablePreopen() {
        var translator = new CapabilityTranslator(sandboxRoot, true, true);
        var permissions = new PackPermissions(
            NetworkPermissions.none(),
            new FilesystemPermissions(List.of("state"), List.of("state/"))
        );

        var descriptor = translator.build("p", permissions, Map.of(), new PackLimits(1, 1));

        assertEquals(1, descriptor.preopenDirs().size());
        assertFalse(descriptor.preopenDirs().get(0).readonly());
    }

    @Test
    void noPermissionsMeansNoPreopens() {
        var descriptor = new CapabilityTranslator(sandboxRoot, true, true)
            .build("p", PackPermissions.none(), null, new PackLimits(16, 100));

        assertTrue(descriptor.preopenDirs().isEmpty());
        assertTrue(descriptor.envVars().isEmpty());
    }

    @Test
    void traversalInGuestPathIsRejected() {
        var translator = new CapabilityTranslator(sandboxRoot, true, true);
        var permissions = new PackPermissions(
            NetworkPermissions.none(),
            new FilesystemPermissions(List.of("data/../../etc"), List.of())
        );

        assertThrows(ManifestInvalidException.class,
            () -> translator.build("p", permissions, Map.of(), new PackLimits(1, 1)));
    }

    @Test
    void serialisesSnakeCaseDescriptor() throws Exception {
        var translator = new CapabilityTranslator(sandboxRoot, false, true);
        var permissions = new PackPermissions(
            NetworkPermissions.none(),
            new FilesystemPermissions(List.of("data"), List.of())
        );
        var descriptor = translator.build("p", permissions, Map.of("A", "1"), new PackLimits(32, 250));

        var json = Json.mapper().readTree(descriptor.toJson());

        var preopen = json.get("preopen_dirs").get(0);
        assertEquals("data", preopen.get("guest_path").asText());
        assertEquals(sandboxRoot.resolve("p/data").toString(), preopen.get("host_path").asText());
        assertTrue(preopen.get("readonly").asBoolean());
        assertEquals("1", json.get("env_vars").get("A").asText());
        assertFalse(json.get("inherit_stdout").asBoolean());
        assertTrue(json.get("inherit_stderr").asBoolean());
        assertEquals(32, json.get("memory_limit_mb").asInt());
        assertEquals(250, json.get("cpu_limit_ms_per_sec").asInt());
    }

    @Test
    void preparesHostDirectories() {
        var translator = new CapabilityTranslator(sandboxRoot, true, true);
        var permissions = new PackPermissions(
            NetworkPermissions.none(),
            new FilesystemPermissions(List.of("in"), List.of("out/nested"))
        );
        var descriptor = translator.build("p", permissions, Map.of(), new PackLimits(1, 1));

        translator.prepareHostDirectories(descriptor);

        assertTrue(Files.isDirectory(sandboxRoot.resolve("p/in")));
        assertTrue(Files.isDirectory(sandboxRoot.resolve("p/out/nested")));
    }

    @Test
    void normalisesGuestPaths() {
        assertEquals("a/b", CapabilityTranslator.normalizeGuestPath("./a//b/"));
        assertEquals(".", CapabilityTranslator.normalizeGuestPath("./"));
        assertEquals("a", CapabilityTranslator.normalizeGuestPath("/a"));
    }
}
