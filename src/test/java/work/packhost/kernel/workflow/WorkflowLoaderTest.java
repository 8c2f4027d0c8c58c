package work.packhost.kernel.workflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.packhost.kernel.error.InvalidWorkflowException;
import work.packhost.kernel.log.LogLevel;

class WorkflowLoaderTest {
    @Test
    void parsesEveryStepType() {
        var workflow = WorkflowLoader.parse("""
            {
              "workflow_version": "1",
              "id": "all",
              "description": "every step",
              "steps": [
                { "id": "a", "type": "http.request", "method": "PUT", "url": "https://api.example.com/v1", "headers": {"X-Trace": 7} },
                { "id": "b", "type": "sandbox.call", "function": "run", "input_from": "a.body" },
                { "id": "c", "type": "kv.put", "key": "k", "value": [1, 2] },
                { "id": "d", "type": "kv.get", "key": "k" },
                { "id": "e", "type": "log", "level": "warning", "message": "hi" },
                { "id": "f", "type": "sleep", "duration_ms": 250 },
                { "id": "g", "type": "emit.event", "event_type": "done" }
              ]
            }
            """, false);

        assertEquals("all", workflow.id());
        assertEquals("every step", workflow.description());
        assertEquals(7, workflow.steps().size());
        var http = assertInstanceOf(WorkflowStep.HttpRequest.class, workflow.steps().get(0));
        assertEquals("PUT", http.method());
        assertEquals(Map.of("X-Trace", "7"), http.headers());
        assertNull(http.body());
        var call = assertInstanceOf(WorkflowStep.SandboxCall.class, workflow.steps().get(1));
        assertEquals(WorkflowStep.SandboxCall.DEFAULT_MODULE, call.module());
        assertEquals("a.body", call.inputFrom());
        assertEquals(LogLevel.WARN, ((WorkflowStep.Log) workflow.steps().get(4)).level());
        assertEquals(Duration.ofMillis(250), ((WorkflowStep.Sleep) workflow.steps().get(5)).duration());
        assertEquals(Map.of(), ((WorkflowStep.EmitEvent) workflow.steps().get(6)).payload());
    }

    @Test
    void httpMethodDefaultsToGet() {
        var workflow = WorkflowLoader.parse("""
            { "id": "w", "steps": [ { "id": "s", "type": "http.request", "url": "https://example.com" } ] }
            """, false);

        assertEquals("GET", ((WorkflowStep.HttpRequest) workflow.steps().get(0)).method());
    }

    @Test
    void readsYamlFiles(@TempDir Path dir) throws Exception {
        var file = dir.resolve("workflow.yaml");
        Files.writeString(file, """
            id: nightly
            steps:
              - id: wait
                type: sleep
                duration: 2s
              - id: call
                type: wasm.call
                module: lib/transform.wasm
                function: shape
            """);

        var workflow = WorkflowLoader.load(file);

        assertEquals(Duration.ofSeconds(2), ((WorkflowStep.Sleep) workflow.steps().get(0)).duration());
        var call = (WorkflowStep.SandboxCall) workflow.steps().get(1);
        assertEquals(StepType.SANDBOX_CALL, call.type());
        assertEquals("lib/transform.wasm", call.module());
    }

    @Test
    void rejectsStructuralProblems() {
        assertThrows(InvalidWorkflowException.class, () -> WorkflowLoader.parse("not json", false));
        assertThrows(InvalidWorkflowException.class, () -> WorkflowLoader.parse("{\"id\":\"w\"}", false));
        assertThrows(InvalidWorkflowException.class, () -> WorkflowLoader.parse("{\"id\":\"w\",\"steps\":[]}", false));
        assertThrows(InvalidWorkflowException.class, () -> WorkflowLoader.parse("""
            { "steps": [ { "id": "s", "type": "log", "message": "m" } ] }
            """, false));
    }

    @Test
    void rejectsDuplicateStepIds() {
        var ex = assertThrows(InvalidWorkflowException.class, () -> WorkflowLoader.parse("""
            { "id": "w", "steps": [
              { "id": "s", "type": "log", "message": "one" },
              { "id": "s", "type": "log", "message": "two" }
            ] }
            """, false));

        assertTrue(ex.getMessage().contains("[s]"));
    }

    @Test
    void rejectsInvalidSteps() {
        assertThrows(InvalidWorkflowException.class, () -> WorkflowLoader.parse("""
            { "id": "w", "steps": [ { "id": "s", "type": "shell.exec" } ] }
            """, false));
        assertThrows(InvalidWorkflowException.class, () -> WorkflowLoader.parse("""
            { "id": "w", "steps": [ { "id": "s", "type": "kv.put", "key": "k" } ] }
            """, false));
        assertThrows(InvalidWorkflowException.class, () -> WorkflowLoader.parse("""
            { "id": "w", "steps": [ { "id": "s", "type": "sleep" } ] }
            """, false));
        assertThrows(InvalidWorkflowException.class, () -> WorkflowLoader.parse("""
            { "id": "w", "steps": [ { "id": "s", "type": "sleep", "duration": "soon" } ] }
            """, false));
        assertThrows(InvalidWorkflowException.class, () -> WorkflowLoader.parse("""
            { "id": "w", "steps": [ { "id": "s", "type": "http.request" } ] }
            """, false));
    }
}
