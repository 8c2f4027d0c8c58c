package work.packhost.kernel.pack;

/**
 * DEV installs skip checksum enforcement; PROD installs always require a verified checksum.
 */
public enum InstallMode {
    DEV,
    PROD
}
