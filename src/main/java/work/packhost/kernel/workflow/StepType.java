package work.packhost.kernel.workflow;

import java.util.Locale;
import work.packhost.kernel.error.InvalidWorkflowException;

public enum StepType {
    HTTP_REQUEST("http.request"),
    SANDBOX_CALL("sandbox.call"),
    KV_PUT("kv.put"),
    KV_GET("kv.get"),
    LOG("log"),
    SLEEP("sleep"),
    EMIT_EVENT("emit.event");

    private final String wireName;

    StepType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a step {@code type} field. {@code wasm.call} is read as {@code sandbox.call}.
     */
    public static StepType from(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidWorkflowException("Step type is missing");
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("wasm.call".equals(normalized)) {
            return SANDBOX_CALL;
        }
        for (StepType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new InvalidWorkflowException("Unsupported step type: " + value);
    }
}
