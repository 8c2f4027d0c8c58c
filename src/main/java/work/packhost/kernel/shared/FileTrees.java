package work.packhost.kernel.shared;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.packhost.kernel.error.ZipSlipViolationException;

/**
 * File tree helpers shared by the installer and the sandbox directory layout. Symbolic links are
 * removed, never followed.
 */
public final class FileTrees {
    private static final Logger log = LoggerFactory.getLogger(FileTrees.class);

    private FileTrees() {}

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Cleanup variant used on failure paths: errors are logged so they do not mask the original failure.
     */
    public static void deleteQuietly(Path root) {
        try {
            deleteRecursively(root);
        } catch (IOException ex) {
            log.warn("Failed to remove {}: {}", root, ex.getMessage());
        }
    }

    /**
     * Fails unless {@code candidate}, with every link on its way followed, stays under the real path
     * of {@code root}. A missing file is checked on its normalized path.
     */
    public static void requireInside(Path root, Path candidate, String name) throws IOException {
        var realRoot = root.toRealPath();
        var resolved = Files.exists(candidate)
            ? candidate.toRealPath()
            : realRoot.resolve(root.toAbsolutePath().normalize().relativize(candidate.toAbsolutePath().normalize())).normalize();
        if (!resolved.startsWith(realRoot)) {
            throw new ZipSlipViolationException(name);
        }
    }

    public static void copyRecursively(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                var destination = target.resolve(source.relativize(file).toString());
                if (attrs.isSymbolicLink()) {
                    Files.createSymbolicLink(destination, Files.readSymbolicLink(file));
                } else {
                    Files.copy(file, destination);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Applies the permission bits of a unix mode where the file system supports them.
     */
    public static void applyPermissions(Path file, int mode) {
        if (mode <= 0) {
            return;
        }
        try {
            Files.setPosixFilePermissions(file, modeToPermissions(mode));
        } catch (UnsupportedOperationException | IOException ex) {
            log.debug("Cannot apply mode {} to {}: {}", Integer.toOctalString(mode), file, ex.getMessage());
        }
    }

    static Set<PosixFilePermission> modeToPermissions(int mode) {
        EnumSet<PosixFilePermission> perms = EnumSet.noneOf(PosixFilePermission.class);
        if ((mode & 0400) != 0) perms.add(PosixFilePermission.OWNER_READ);
        if ((mode & 0200) != 0) perms.add(PosixFilePermission.OWNER_WRITE);
        if ((mode & 0100) != 0) perms.add(PosixFilePermission.OWNER_EXECUTE);
        if ((mode & 0040) != 0) perms.add(PosixFilePermission.GROUP_READ);
        if ((mode & 0020) != 0) perms.add(PosixFilePermission.GROUP_WRITE);
        if ((mode & 0010) != 0) perms.add(PosixFilePermission.GROUP_EXECUTE);
        if ((mode & 0004) != 0) perms.add(PosixFilePermission.OTHERS_READ);
        if ((mode & 0002) != 0) perms.add(PosixFilePermission.OTHERS_WRITE);
        if ((mode & 0001) != 0) perms.add(PosixFilePermission.OTHERS_EXECUTE);
        // keep extracted files readable and writable by the host
        perms.add(PosixFilePermission.OWNER_READ);
        perms.add(PosixFilePermission.OWNER_WRITE);
        return perms;
    }
}
