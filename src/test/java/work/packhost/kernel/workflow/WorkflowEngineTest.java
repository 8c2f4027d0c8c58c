package work.packhost.kernel.workflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpServer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.packhost.kernel.error.NetworkCapabilityDeniedException;
import work.packhost.kernel.error.PackHostException;
import work.packhost.kernel.error.RuntimeTrapException;
import work.packhost.kernel.error.WorkflowCancelledException;
import work.packhost.kernel.error.WorkflowStepFailureException;
import work.packhost.kernel.kv.InMemoryKvStore;
import work.packhost.kernel.log.LogLevel;
import work.packhost.kernel.pack.FilesystemPermissions;
import work.packhost.kernel.pack.NetworkPermissions;
import work.packhost.kernel.pack.PackPermissions;
import work.packhost.kernel.sandbox.CapabilityDescriptor;
import work.packhost.kernel.sandbox.PermissionEnforcer;
import work.packhost.kernel.sandbox.SandboxRuntime;
import work.packhost.kernel.sandbox.SandboxSession;
import work.packhost.kernel.support.FakeSandboxEngine;
import work.packhost.kernel.support.RecordingLogSink;

class WorkflowEngineTest {
    @TempDir
    Path temp;

    private final InMemoryKvStore kv = new InMemoryKvStore();
    private final RecordingLogSink logs = new RecordingLogSink();
    private final EventBus events = new EventBus();
    private final WorkflowEngine engine = new WorkflowEngine(kv, logs, new PermissionEnforcer(), events, Duration.ofSeconds(5));
    private HttpServer server;
    private final AtomicReference<String> lastRequestBody = new AtomicReference<>();
    private final AtomicReference<String> lastContentType = new AtomicReference<>();

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api", exchange -> {
            lastRequestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            var body = "{\"temperature\":21}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("X-Source", "test");
            exchange.sendResponseHeaders(200, body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private String api() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/api";
    }

    private PackPermissions allowApi() {
        return new PackPermissions(new NetworkPermissions(List.of(api()), false), FilesystemPermissions.none());
    }

    @Test
    void runsStepsInOrderAndCollectsResults() {
        var workflow = WorkflowLoader.parse("""
            {
              "id": "collect",
              "steps": [
                { "id": "fetch", "type": "http.request", "method": "POST", "url": "%s/current", "body": {"city": "Lyon"} },
                { "id": "store", "type": "kv.put", "key": "last", "value": {"t": 21} },
                { "id": "read", "type": "kv.get", "key": "last" },
                { "id": "note", "type": "log", "level": "warn", "message": "fetched" }
              ]
            }
            """.formatted(api()), false);
        var ctx = new WorkflowContext("weather", "i-1", allowApi());
        var progress = new CopyOnWriteArrayList<WorkflowProgress>();

        var result = engine.execute(workflow, ctx, progress::add).getOrThrow();

        @SuppressWarnings("unchecked")
        var fetch = (Map<String, Object>) result.stepResults().get("fetch");
        assertEquals(200, fetch.get("status"));
        assertEquals("{\"temperature\":21}", fetch.get("body"));
        assertEquals("{\"city\":\"Lyon\"}", lastRequestBody.get());
        assertEquals("application/json", lastContentType.get());
        assertEquals(Map.of("t", 21), result.stepResults().get("read"));
        assertEquals(List.of("fetch", "store", "read", "note"), List.copyOf(result.stepResults().keySet()));
        assertTrue(kv.get("weather", "last").isPresent());
        assertTrue(logs.entries().stream().anyMatch(e -> e.level() == LogLevel.WARN && e.message().equals("fetched")));
        assertEquals(100, progress.get(progress.size() - 1).percent());
        assertEquals(4, ctx.nextStepIndex());
    }

    @Test
    void failingThirdStepHaltsAndKeepsEarlierResults() {
        var workflow = WorkflowLoader.parse("""
            {
              "id": "four",
              "steps": [
                { "id": "s1", "type": "kv.put", "key": "a", "value": 1 },
                { "id": "s2", "type": "log", "message": "between" },
                { "id": "s3", "type": "http.request", "url": "https://not-allowed.example.com/x" },
                { "id": "s4", "type": "kv.put", "key": "b", "value": 2 }
              ]
            }
            """, false);
        var ctx = new WorkflowContext("p", "i", allowApi());

        var result = engine.execute(workflow, ctx);

        var failure = assertInstanceOf(WorkflowStepFailureException.class, result.error());
        assertEquals("s3", failure.stepId());
        assertInstanceOf(NetworkCapabilityDeniedException.class, failure.getCause());
        assertEquals(List.of("s1", "s2"), List.copyOf(failure.partialResults().keySet()));
        assertFalse(ctx.stepResult("s3").orElseThrow().success());
        assertTrue(ctx.stepResult("s4").isEmpty());
        assertTrue(kv.get("p", "b").isEmpty());
    }

    @Test
    void cancellationBetweenStepsStopsBeforeTheNextStep() {
        var workflow = WorkflowLoader.parse("""
            {
              "id": "five",
              "steps": [
                { "id": "s1", "type": "kv.put", "key": "k1", "value": 1 },
                { "id": "s2", "type": "kv.put", "key": "k2", "value": 2 },
                { "id": "s3", "type": "kv.put", "key": "k3", "value": 3 },
                { "id": "s4", "type": "kv.put", "key": "k4", "value": 4 },
                { "id": "s5", "type": "kv.put", "key": "k5", "value": 5 }
              ]
            }
            """, false);
        var ctx = new WorkflowContext("p", "i", PackPermissions.none());
        WorkflowProgressListener cancelAfterSecond = progress -> {
            if ("Completed step: s2".equals(progress.message())) {
                ctx.cancel();
            }
        };

        var result = engine.execute(workflow, ctx, cancelAfterSecond);

        var cancelled = assertInstanceOf(WorkflowCancelledException.class, result.error());
        assertEquals(List.of("s1", "s2"), List.copyOf(cancelled.partialResults().keySet()));
        assertEquals(2, ctx.stepResults().size());
        assertTrue(kv.get("p", "k3").isEmpty());

        ctx.resetCancellation();
        var resumed = engine.execute(workflow, ctx).getOrThrow();

        assertEquals(List.of("s1", "s2", "s3", "s4", "s5"), List.copyOf(resumed.stepResults().keySet()));
        assertTrue(kv.get("p", "k5").isPresent());
    }

    @Test
    void sandboxCallReceivesReferencedInput() throws Exception {
        Files.write(temp.resolve("module.wasm"), new byte[] { 0, 0x61, 0x73, 0x6d });
        var fake = new FakeSandboxEngine().on("transform", args -> "{\"echo\":" + args + "}");
        var runtime = new SandboxRuntime(fake);
        var descriptor = new CapabilityDescriptor(List.of(), Map.of(), true, true, 16, 100);
        var workflow = WorkflowLoader.parse("""
            {
              "id": "chain",
              "steps": [
                { "id": "fetch", "type": "http.request", "url": "%s" },
                { "id": "shape", "type": "wasm.call", "function": "transform", "input_from": "fetch.status" }
              ]
            }
            """.formatted(api()), false);
        try (var session = new SandboxSession(runtime, temp, descriptor)) {
            var ctx = new WorkflowContext("p", "i", allowApi(), session);

            var result = engine.execute(workflow, ctx).getOrThrow();

            assertEquals(Map.of("echo", 200), result.stepResults().get("shape"));
            assertEquals(List.of("transform 200"), fake.calls());
        }
        assertEquals(0, fake.liveInstanceCount());
        assertEquals(0, fake.liveModuleCount());
    }

    @Test
    void trappingSandboxCallFailsTheStep() throws Exception {
        Files.write(temp.resolve("module.wasm"), new byte[] { 0, 0x61, 0x73, 0x6d });
        var fake = new FakeSandboxEngine().trapping("boom", "unreachable");
        var workflow = WorkflowLoader.parse("""
            { "id": "trap", "steps": [ { "id": "call", "type": "sandbox.call", "function": "boom" } ] }
            """, false);
        try (var session = new SandboxSession(new SandboxRuntime(fake), temp, new CapabilityDescriptor(List.of(), Map.of(), true, true, 16, 100))) {
            var result = engine.execute(workflow, new WorkflowContext("p", "i", PackPermissions.none(), session));

            var failure = assertInstanceOf(WorkflowStepFailureException.class, result.error());
            assertInstanceOf(RuntimeTrapException.class, failure.getCause());
        }
        assertEquals(0, fake.liveModuleCount());
    }

    @Test
    void sandboxCallWithoutSessionFails() {
        var workflow = WorkflowLoader.parse("""
            { "id": "nosandbox", "steps": [ { "id": "call", "type": "sandbox.call", "function": "run" } ] }
            """, false);

        var result = engine.execute(workflow, new WorkflowContext("p", "i", PackPermissions.none()));

        var failure = assertInstanceOf(WorkflowStepFailureException.class, result.error());
        assertEquals("sandbox_unavailable", assertInstanceOf(PackHostException.class, failure.getCause()).code());
    }

    @Test
    void emitEventPublishesToPackSubscribers() {
        var received = new CopyOnWriteArrayList<WorkflowEvent>();
        events.subscribe("p", received::add);
        var other = new CopyOnWriteArrayList<WorkflowEvent>();
        events.subscribe("someone-else", other::add);
        var workflow = WorkflowLoader.parse("""
            { "id": "events", "steps": [ { "id": "notify", "type": "emit.event", "event_type": "forecast.ready", "payload": {"n": 1} } ] }
            """, false);

        engine.execute(workflow, new WorkflowContext("p", "i-9", PackPermissions.none())).getOrThrow();

        assertEquals(1, received.size());
        var event = received.get(0);
        assertEquals("forecast.ready", event.eventType());
        assertEquals("i-9", event.instanceId());
        assertEquals("notify", event.stepId());
        assertEquals(Map.of("n", 1), event.payload());
        assertTrue(other.isEmpty());
    }

    @Test
    void cancelledSleepResumesWithTheRemainingTime() throws Exception {
        var workflow = WorkflowLoader.parse("""
            { "id": "nap", "steps": [
              { "id": "nap", "type": "sleep", "duration": "1500ms" },
              { "id": "after", "type": "log", "message": "awake" }
            ] }
            """, false);
        var ctx = new WorkflowContext("p", "i", PackPermissions.none());

        var future = engine.executeAsync(workflow, ctx, WorkflowProgressListener.NONE, runnable -> new Thread(runnable, "workflow-test").start());
        Thread.sleep(500);
        ctx.cancel();
        var cancelled = future.get(5, TimeUnit.SECONDS);

        assertInstanceOf(WorkflowCancelledException.class, cancelled.error());
        assertTrue(ctx.stepResult("nap").isEmpty());
        assertEquals(0, ctx.nextStepIndex());
        assertFalse(logs.contains("awake"));

        ctx.resetCancellation();
        var resumed = engine.executeAsync(workflow, ctx, WorkflowProgressListener.NONE, runnable -> new Thread(runnable, "workflow-test").start())
            .get(5, TimeUnit.SECONDS);

        assertTrue(resumed.isSuccess());
        @SuppressWarnings("unchecked")
        var nap = (Map<String, Object>) ctx.stepResult("nap").orElseThrow().value();
        assertEquals(true, nap.get("resumed"));
        assertTrue(((Number) nap.get("slept_ms")).longValue() < 1400, "resumed sleep covers only the remainder");
        assertTrue(logs.contains("awake"));
    }
}
