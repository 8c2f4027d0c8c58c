package work.packhost.kernel.install;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import work.packhost.kernel.error.ChecksumMismatchException;

/**
 * SHA-256 helpers. Digests are rendered as lowercase hex; comparisons ignore case and surrounding
 * whitespace.
 */
public final class ChecksumVerifier {
    private static final int BUFFER_SIZE = 8192;

    private ChecksumVerifier() {}

    public static String sha256(Path file) {
        try (var in = Files.newInputStream(file)) {
            return sha256(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to hash " + file, ex);
        }
    }

    public static String sha256(InputStream in) throws IOException {
        var digest = newDigest();
        var buffer = new byte[BUFFER_SIZE];
        int read;
        while ((read = in.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String sha256(byte[] bytes) {
        return HexFormat.of().formatHex(newDigest().digest(bytes));
    }

    public static boolean matches(String actual, String expected) {
        if (actual == null || expected == null) {
            return false;
        }
        return normalize(actual).equals(normalize(expected));
    }

    /**
     * Hashes {@code file} and returns the digest, or throws when it differs from {@code expected}.
     */
    public static String verify(Path file, String expected) {
        var actual = sha256(file);
        if (!matches(actual, expected)) {
            throw new ChecksumMismatchException(String.valueOf(file.getFileName()), expected, actual);
        }
        return actual;
    }

    static String normalize(String hex) {
        return hex.trim().toLowerCase(Locale.ROOT);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
