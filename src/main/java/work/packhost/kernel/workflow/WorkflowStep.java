package work.packhost.kernel.workflow;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import work.packhost.kernel.log.LogLevel;

/**
 * One declarative workflow step. The variant set is closed; {@link #type()} mirrors the variant.
 */
public sealed interface WorkflowStep {
    String id();

    StepType type();

    record HttpRequest(String id, String method, String url, Map<String, String> headers, Object body) implements WorkflowStep {
        public HttpRequest {
            method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
            headers = headers == null ? Map.of() : Map.copyOf(headers);
        }

        @Override
        public StepType type() {
            return StepType.HTTP_REQUEST;
        }
    }

    /**
     * @param module pack-relative path of the module to call into
     * @param inputFrom {@code stepId} or {@code stepId.path.to.field} of an earlier result
     */
    record SandboxCall(String id, String module, String function, String inputFrom) implements WorkflowStep {
        public static final String DEFAULT_MODULE = "module.wasm";

        public SandboxCall {
            module = module == null || module.isBlank() ? DEFAULT_MODULE : module;
        }

        @Override
        public StepType type() {
            return StepType.SANDBOX_CALL;
        }
    }

    record KvPut(String id, String key, Object value) implements WorkflowStep {
        @Override
        public StepType type() {
            return StepType.KV_PUT;
        }
    }

    record KvGet(String id, String key) implements WorkflowStep {
        @Override
        public StepType type() {
            return StepType.KV_GET;
        }
    }

    record Log(String id, LogLevel level, String message) implements WorkflowStep {
        public Log {
            level = level == null ? LogLevel.INFO : level;
        }

        @Override
        public StepType type() {
            return StepType.LOG;
        }
    }

    record Sleep(String id, Duration duration) implements WorkflowStep {
        public Sleep {
            Objects.requireNonNull(duration, "duration");
        }

        @Override
        public StepType type() {
            return StepType.SLEEP;
        }
    }

    record EmitEvent(String id, String eventType, Object payload) implements WorkflowStep {
        @Override
        public StepType type() {
            return StepType.EMIT_EVENT;
        }
    }
}
