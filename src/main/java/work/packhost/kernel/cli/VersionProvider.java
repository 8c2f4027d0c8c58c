package work.packhost.kernel.cli;

import picocli.CommandLine;
import work.packhost.kernel.sandbox.NativeSandboxEngine;

/**
 * Reports the kernel version and whether the native sandbox library could be loaded.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        var implementationVersion = Main.class.getPackage().getImplementationVersion();
        var sandbox = new NativeSandboxEngine().isAvailable() ? "available" : "not loaded";
        return new String[] {
            "packhost " + (implementationVersion != null ? implementationVersion : "development"),
            "sandbox library " + NativeSandboxEngine.LIBRARY_NAME + ": " + sandbox,
            "java " + System.getProperty("java.version")
        };
    }
}
