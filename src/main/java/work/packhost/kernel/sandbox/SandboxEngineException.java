package work.packhost.kernel.sandbox;

/**
 * Failure raised by a {@link SandboxEngine}. The kind decides how the runtime reacts.
 */
public final class SandboxEngineException extends RuntimeException {
    private final Kind kind;

    public SandboxEngineException(Kind kind, String message) {
        super(message);
        this.kind = kind == null ? Kind.ENGINE_ERROR : kind;
    }

    /**
     * Looked up by name from native code.
     */
    public SandboxEngineException(String kind, String message) {
        this(parseKind(kind), message);
    }

    public Kind kind() {
        return kind;
    }

    private static Kind parseKind(String kind) {
        if (kind == null) {
            return Kind.ENGINE_ERROR;
        }
        try {
            return Kind.valueOf(kind);
        } catch (IllegalArgumentException ex) {
            return Kind.ENGINE_ERROR;
        }
    }

    public enum Kind {
        TRAP,
        RESOURCE_LIMIT,
        INVALID_HANDLE,
        LOAD_FAILED,
        ENGINE_ERROR
    }
}
