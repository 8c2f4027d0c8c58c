package work.packhost.kernel.error;

import java.util.LinkedHashMap;
import java.util.Map;

public final class ChecksumMismatchException extends PackHostException {
    private final String expected;
    private final String actual;

    public ChecksumMismatchException(String subject, String expected, String actual) {
        super("checksum_mismatch", "Checksum verification failed for " + subject, details(subject, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }

    @Override
    public boolean securityFailure() {
        return true;
    }

    private static Map<String, Object> details(String subject, String expected, String actual) {
        var map = new LinkedHashMap<String, Object>();
        map.put("subject", subject);
        map.put("expected", expected);
        map.put("actual", actual);
        return map;
    }
}
