package work.packhost.kernel.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.packhost.kernel.error.ZipSlipViolationException;
import work.packhost.kernel.support.PackArchives;

class PackHostCommandTest {
    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @TempDir
    Path temp;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void checksumPrintsDigest() throws Exception {
        var file = Files.writeString(temp.resolve("abc.txt"), "abc");

        assertEquals(0, execute("checksum", file.toString()));
        assertTrue(out.toString().startsWith(ABC_SHA256 + "  abc.txt"));
    }

    @Test
    void checksumMismatchFailsWithCode() throws Exception {
        var file = Files.writeString(temp.resolve("abc.txt"), "abc");

        assertEquals(1, execute("checksum", file.toString(), "--expect", "00"));
        assertTrue(err.toString().contains("checksum_mismatch"));
    }

    @Test
    void installPrintsInstalledPack() throws Exception {
        var archive = PackArchives.wasmPack("cli-demo").writeZip(temp.resolve("pack-cli-demo-x86-1.0.0.zip"));

        int exit = execute("install", archive.toString(), "--data-dir", temp.resolve("data").toString());

        assertEquals(0, exit, err.toString());
        assertTrue(out.toString().contains("\"status\" : \"success\""));
        assertTrue(out.toString().contains("cli-demo"));
        assertTrue(Files.isDirectory(temp.resolve("data/packs/cli-demo")));
    }

    @Test
    void prodInstallWithoutChecksumFails() throws Exception {
        var archive = PackArchives.wasmPack("cli-demo").writeZip(temp.resolve("pack.zip"));

        int exit = execute("install", archive.toString(), "--prod", "--data-dir", temp.resolve("data").toString());

        assertEquals(1, exit);
        assertTrue(out.toString().contains("checksum_required"));
    }

    @Test
    void errorLineNamesInnermostKernelFailure() {
        var wrapped = new IllegalStateException("outer", new ZipSlipViolationException("../evil"));

        var line = ShortErrorHandler.describe(wrapped);

        assertTrue(line.startsWith("zip_slip_violation: "));
        assertTrue(line.endsWith("(security check failed)"));
        assertEquals("unexpected_error: boom", ShortErrorHandler.describe(new IllegalArgumentException("boom")));
    }

    @Test
    void versionIsPrinted() {
        assertEquals(0, execute("--version"));
        assertTrue(out.toString().startsWith("packhost "));
    }
}
