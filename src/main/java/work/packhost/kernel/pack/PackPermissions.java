package work.packhost.kernel.pack;

/**
 * Closed allow-list of capabilities a pack may use. Anything not listed here is denied.
 */
public record PackPermissions(NetworkPermissions network, FilesystemPermissions filesystem) {
    public PackPermissions {
        network = network == null ? NetworkPermissions.none() : network;
        filesystem = filesystem == null ? FilesystemPermissions.none() : filesystem;
    }

    public static PackPermissions none() {
        return new PackPermissions(NetworkPermissions.none(), FilesystemPermissions.none());
    }
}
