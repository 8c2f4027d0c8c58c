package work.packhost.kernel.error;

/**
 * Base failure raised by the kernel. Carries a stable machine-readable code and optional
 * structured data next to the human-readable message.
 */
public class PackHostException extends RuntimeException {
    private final String code;
    private final Object data;

    public PackHostException(String code, String message) {
        this(code, message, null, null);
    }

    public PackHostException(String code, String message, Object data) {
        this(code, message, data, null);
    }

    public PackHostException(String code, String message, Object data, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = data;
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }

    /**
     * Security-class failures (checksum, archive escape, capability denial) must never be
     * reported as warnings.
     */
    public boolean securityFailure() {
        return false;
    }
}
