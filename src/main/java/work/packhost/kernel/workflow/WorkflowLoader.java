package work.packhost.kernel.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import work.packhost.kernel.error.InvalidWorkflowException;
import work.packhost.kernel.log.LogLevel;
import work.packhost.kernel.shared.DurationParser;
import work.packhost.kernel.shared.Json;

/**
 * Reads {@code workflow.json} (or a YAML equivalent) into a validated {@link Workflow}.
 */
public final class WorkflowLoader {
    private WorkflowLoader() {}

    public static Workflow load(Path file) {
        var name = String.valueOf(file.getFileName()).toLowerCase(Locale.ROOT);
        boolean yaml = name.endsWith(".yaml") || name.endsWith(".yml");
        try {
            return parse(Files.readString(file), yaml);
        } catch (IOException ex) {
            throw new InvalidWorkflowException("Failed to read workflow " + file + ": " + ex.getMessage(), ex);
        }
    }

    public static Workflow parse(String content, boolean yaml) {
        ObjectMapper mapper = yaml ? Json.yamlMapper() : Json.mapper();
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (IOException ex) {
            throw new InvalidWorkflowException("Malformed workflow: " + ex.getMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidWorkflowException("Workflow must be an object");
        }
        var stepsNode = root.get("steps");
        if (stepsNode == null || !stepsNode.isArray()) {
            throw new InvalidWorkflowException("Workflow steps must be an array");
        }
        var steps = new ArrayList<WorkflowStep>();
        for (JsonNode stepNode : stepsNode) {
            steps.add(parseStep(stepNode));
        }
        var workflow = new Workflow(
            root.path("workflow_version").asText("1"),
            root.path("id").asText(null),
            root.hasNonNull("description") ? root.get("description").asText() : null,
            steps
        );
        workflow.validate();
        return workflow;
    }

    static WorkflowStep parseStep(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidWorkflowException("Workflow step must be an object");
        }
        var id = required(node, "id", "?");
        var type = StepType.from(node.path("type").asText(null));
        return switch (type) {
            case HTTP_REQUEST -> new WorkflowStep.HttpRequest(
                id,
                node.path("method").asText("GET"),
                required(node, "url", id),
                headers(node.get("headers"), id),
                node.has("body") ? toValue(node.get("body")) : null);
            case SANDBOX_CALL -> new WorkflowStep.SandboxCall(
                id,
                optional(node, "module"),
                required(node, "function", id),
                optional(node, "input_from"));
            case KV_PUT -> {
                if (!node.has("value")) {
                    throw new InvalidWorkflowException("Step " + id + " is missing value");
                }
                yield new WorkflowStep.KvPut(id, required(node, "key", id), toValue(node.get("value")));
            }
            case KV_GET -> new WorkflowStep.KvGet(id, required(node, "key", id));
            case LOG -> new WorkflowStep.Log(id, LogLevel.from(optional(node, "level")), required(node, "message", id));
            case SLEEP -> new WorkflowStep.Sleep(id, duration(node, id));
            case EMIT_EVENT -> new WorkflowStep.EmitEvent(
                id,
                required(node, "event_type", id),
                node.has("payload") ? toValue(node.get("payload")) : Map.of());
        };
    }

    private static Duration duration(JsonNode node, String id) {
        var millis = node.get("duration_ms");
        if (millis != null && !millis.isNull()) {
            if (!millis.canConvertToLong() || millis.asLong() < 0) {
                throw new InvalidWorkflowException("Step " + id + " has an invalid duration_ms");
            }
            return Duration.ofMillis(millis.asLong());
        }
        var text = optional(node, "duration");
        if (text == null || text.isBlank()) {
            throw new InvalidWorkflowException("Step " + id + " needs duration_ms or duration");
        }
        try {
            return DurationParser.parse(text).orElseThrow();
        } catch (IllegalArgumentException ex) {
            throw new InvalidWorkflowException("Step " + id + ": " + ex.getMessage(), ex);
        }
    }

    private static Map<String, String> headers(JsonNode node, String id) {
        var headers = new LinkedHashMap<String, String>();
        if (node == null || node.isNull()) {
            return headers;
        }
        if (!node.isObject()) {
            throw new InvalidWorkflowException("Step " + id + " headers must be an object");
        }
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            headers.put(entry.getKey(), entry.getValue().asText());
        }
        return headers;
    }

    private static Object toValue(JsonNode node) {
        return Json.mapper().convertValue(node, Object.class);
    }

    private static String required(JsonNode node, String field, String stepId) {
        var value = optional(node, field);
        if (value == null || value.isBlank()) {
            throw new InvalidWorkflowException("Step " + stepId + " is missing " + field);
        }
        return value;
    }

    private static String optional(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
