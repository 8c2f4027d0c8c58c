package work.packhost.kernel.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalises arbitrary throwables into kernel failures and their map rendering.
 */
public final class HostErrors {
    private HostErrors() {}

    public static PackHostException normalize(Throwable error) {
        if (error instanceof PackHostException phe) {
            return phe;
        }
        if (error == null) {
            return new PackHostException("unexpected_error", "Unexpected error");
        }
        return new PackHostException("unexpected_error", describe(error), null, error);
    }

    public static Map<String, Object> toMap(Throwable error) {
        var normalized = normalize(error);
        var map = new LinkedHashMap<String, Object>();
        map.put("code", normalized.code());
        map.put("message", normalized.getMessage());
        if (normalized.data() != null) {
            map.put("data", normalized.data());
        }
        return map;
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "Unexpected error";
        }
        var message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
