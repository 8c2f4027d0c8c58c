package work.packhost.kernel.install;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.packhost.kernel.error.ArchiveTooLargeException;
import work.packhost.kernel.error.PackHostException;
import work.packhost.kernel.error.ZipSlipViolationException;
import work.packhost.kernel.shared.FileTrees;

/**
 * Extracts zip and gzip'd tar archives under a destination root. Every entry, symlink target and
 * parent directory must resolve inside the root; the first violation aborts the extraction and
 * removes everything written so far.
 */
public final class ArchiveExtractor {
    private static final Logger log = LoggerFactory.getLogger(ArchiveExtractor.class);
    private static final int BUFFER_SIZE = 8192;

    private final ArchiveLimits limits;

    public ArchiveExtractor() {
        this(ArchiveLimits.defaults());
    }

    public ArchiveExtractor(ArchiveLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    public ArchiveLimits limits() {
        return limits;
    }

    /**
     * @return regular files written, in archive order
     */
    public List<Path> extract(Path archive, Path destinationRoot) {
        boolean createdRoot = !Files.exists(destinationRoot);
        var session = new Session();
        try {
            Files.createDirectories(destinationRoot);
            session.root = destinationRoot.toRealPath();
            switch (detectFormat(archive)) {
                case ZIP -> extractZip(archive, session);
                case TAR_GZ -> extractTarGz(archive, session);
            }
            log.debug("Extracted {} files from {}", session.files.size(), archive.getFileName());
            return Collections.unmodifiableList(session.files);
        } catch (PackHostException ex) {
            rollback(session, destinationRoot, createdRoot);
            if (ex.securityFailure()) {
                log.error("Aborted extraction of {}: {}", archive.getFileName(), ex.getMessage());
            }
            throw ex;
        } catch (IOException | RuntimeException ex) {
            rollback(session, destinationRoot, createdRoot);
            throw new PackHostException("extraction_failed", "Failed to extract " + archive.getFileName() + ": " + ex.getMessage(), null, ex);
        }
    }

    static ArchiveFormat detectFormat(Path archive) throws IOException {
        var header = new byte[4];
        int read;
        try (var in = Files.newInputStream(archive)) {
            read = in.readNBytes(header, 0, header.length);
        }
        if (read >= 2 && (header[0] & 0xff) == 0x1f && (header[1] & 0xff) == 0x8b) {
            return ArchiveFormat.TAR_GZ;
        }
        if (read == 4 && header[0] == 'P' && header[1] == 'K'
            && ((header[2] == 3 && header[3] == 4) || (header[2] == 5 && header[3] == 6))) {
            return ArchiveFormat.ZIP;
        }
        throw new PackHostException("unsupported_archive", "Unsupported archive format: " + archive.getFileName());
    }

    private void extractZip(Path archive, Session session) throws IOException {
        try (var zip = new ZipFile(archive.toFile())) {
            var entries = zip.getEntriesInPhysicalOrder();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry entry = entries.nextElement();
                session.countEntry(entry.getName());
                if (entry.isUnixSymlink()) {
                    createSymlink(session, entry.getName(), zip.getUnixSymlink(entry));
                } else if (entry.isDirectory()) {
                    createDirectory(session, entry.getName());
                } else {
                    try (var in = zip.getInputStream(entry)) {
                        writeFile(session, entry.getName(), in, entry.getUnixMode());
                    }
                }
            }
        }
    }

    private void extractTarGz(Path archive, Session session) throws IOException {
        try (
            InputStream raw = new BufferedInputStream(Files.newInputStream(archive));
            var gzip = new GzipCompressorInputStream(raw);
            var tar = new TarArchiveInputStream(gzip)
        ) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextTarEntry()) != null) {
                session.countEntry(entry.getName());
                if (entry.isSymbolicLink()) {
                    createSymlink(session, entry.getName(), entry.getLinkName());
                } else if (entry.isLink()) {
                    copyHardLink(session, entry.getName(), entry.getLinkName());
                } else if (entry.isDirectory()) {
                    createDirectory(session, entry.getName());
                } else if (entry.isFile()) {
                    writeFile(session, entry.getName(), tar, entry.getMode());
                } else {
                    log.debug("Skipping special tar entry {}", entry.getName());
                }
            }
        }
    }

    private void createDirectory(Session session, String name) throws IOException {
        var target = resolveInside(session, name);
        ensureDirectory(session, target, name);
    }

    private void writeFile(Session session, String name, InputStream in, int mode) throws IOException {
        var target = resolveInside(session, name);
        ensureDirectory(session, target.getParent(), name);
        if (Files.isSymbolicLink(target)) {
            throw new ZipSlipViolationException(name);
        }
        boolean existed = Files.exists(target, LinkOption.NOFOLLOW_LINKS);
        try (var out = Files.newOutputStream(target, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            if (!existed) {
                session.created.add(target);
            }
            var buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                session.addBytes(read);
                out.write(buffer, 0, read);
            }
        }
        FileTrees.applyPermissions(target, mode);
        session.files.add(target);
    }

    /**
     * Walks the link target one component at a time from the link's real parent. The target may not
     * leave the root at any step nor pass through a symlink, and no later symlink may be created on a
     * path an earlier target passes through.
     */
    private void createSymlink(Session session, String name, String linkName) throws IOException {
        var link = resolveInside(session, name);
        if (linkName == null || linkName.isBlank() || linkName.indexOf('\0') >= 0) {
            throw new ZipSlipViolationException(name);
        }
        var normalizedTarget = linkName.replace('\\', '/');
        if (normalizedTarget.startsWith("/")) {
            throw new ZipSlipViolationException(name + " -> " + linkName);
        }
        ensureDirectory(session, link.getParent(), name);
        var parent = link.getParent().toRealPath();
        if (Files.exists(link, LinkOption.NOFOLLOW_LINKS) || session.traversed.contains(parent.resolve(link.getFileName()))) {
            throw new ZipSlipViolationException(name);
        }
        var parts = new ArrayList<String>();
        for (String part : normalizedTarget.split("/")) {
            if (!part.isEmpty() && !part.equals(".")) {
                parts.add(part);
            }
        }
        var cursor = parent;
        for (int i = 0; i < parts.size(); i++) {
            cursor = parts.get(i).equals("..") ? cursor.getParent() : cursor.resolve(parts.get(i));
            if (cursor == null || !cursor.startsWith(session.root)) {
                throw new ZipSlipViolationException(name + " -> " + linkName);
            }
            if (i < parts.size() - 1) {
                if (Files.isSymbolicLink(cursor)) {
                    throw new ZipSlipViolationException(name + " -> " + linkName);
                }
                session.traversed.add(cursor);
            }
        }
        Files.createSymbolicLink(link, Path.of(linkName));
        session.created.add(link);
    }

    private void copyHardLink(Session session, String name, String linkName) throws IOException {
        var link = resolveInside(session, name);
        var source = resolveInside(session, linkName);
        if (!Files.isRegularFile(source, LinkOption.NOFOLLOW_LINKS)) {
            throw new ZipSlipViolationException(name + " -> " + linkName);
        }
        FileTrees.requireInside(session.root, source, name + " -> " + linkName);
        try (var in = Files.newInputStream(source)) {
            writeFile(session, name, in, 0);
        }
        log.trace("Materialised hard link {} as a copy", link);
    }

    private Path resolveInside(Session session, String name) {
        if (name == null || name.isEmpty() || name.indexOf('\0') >= 0) {
            throw new ZipSlipViolationException(String.valueOf(name));
        }
        var normalizedName = name.replace('\\', '/');
        if (normalizedName.startsWith("/")) {
            throw new ZipSlipViolationException(name);
        }
        var target = session.root.resolve(normalizedName).normalize();
        if (!target.startsWith(session.root)) {
            throw new ZipSlipViolationException(name);
        }
        return target;
    }

    /**
     * Creates {@code dir} and its missing parents, then re-checks the real path so a symlink
     * extracted earlier cannot redirect writes outside the root.
     */
    private void ensureDirectory(Session session, Path dir, String entryName) throws IOException {
        if (dir == null) {
            return;
        }
        var missing = new ArrayList<Path>();
        var cursor = dir;
        while (cursor != null && cursor.startsWith(session.root) && !Files.exists(cursor, LinkOption.NOFOLLOW_LINKS)) {
            missing.add(cursor);
            cursor = cursor.getParent();
        }
        for (int i = missing.size() - 1; i >= 0; i--) {
            Files.createDirectory(missing.get(i));
            session.created.add(missing.get(i));
        }
        if (!dir.toRealPath().startsWith(session.root)) {
            throw new ZipSlipViolationException(entryName);
        }
    }

    private void rollback(Session session, Path destinationRoot, boolean createdRoot) {
        if (createdRoot) {
            FileTrees.deleteQuietly(destinationRoot);
            return;
        }
        for (int i = session.created.size() - 1; i >= 0; i--) {
            try {
                Files.deleteIfExists(session.created.get(i));
            } catch (IOException ex) {
                log.warn("Failed to remove partially extracted {}: {}", session.created.get(i), ex.getMessage());
            }
        }
    }

    enum ArchiveFormat {
        ZIP,
        TAR_GZ
    }

    private final class Session {
        private Path root;
        private final List<Path> created = new ArrayList<>();
        private final List<Path> files = new ArrayList<>();
        private final Set<Path> traversed = new HashSet<>();
        private int entries;
        private long bytes;

        void countEntry(String name) {
            entries++;
            if (entries > limits.maxEntries()) {
                throw new ArchiveTooLargeException("Archive has more than " + limits.maxEntries() + " entries (at " + name + ")");
            }
        }

        void addBytes(int count) {
            bytes += count;
            if (bytes > limits.maxTotalBytes()) {
                throw new ArchiveTooLargeException("Archive expands beyond " + limits.maxTotalBytes() + " bytes");
            }
        }
    }
}
