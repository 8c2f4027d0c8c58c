package work.packhost.kernel.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.packhost.kernel.api.Result;
import work.packhost.kernel.error.HostErrors;
import work.packhost.kernel.error.PackHostException;
import work.packhost.kernel.error.SandboxUnavailableException;
import work.packhost.kernel.error.WorkflowCancelledException;
import work.packhost.kernel.error.WorkflowStepFailureException;
import work.packhost.kernel.kv.KvStore;
import work.packhost.kernel.log.LogLevel;
import work.packhost.kernel.log.LogSink;
import work.packhost.kernel.log.LogSource;
import work.packhost.kernel.sandbox.PermissionEnforcer;
import work.packhost.kernel.shared.Json;

/**
 * Runs workflow steps strictly in declaration order. Cancellation is checked before every step and
 * never interrupts a step already running. The first failing step halts the run; results of the
 * steps before it stay in the context and travel with the failure.
 */
public final class WorkflowEngine {
    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final KvStore kvStore;
    private final LogSink logSink;
    private final PermissionEnforcer permissionEnforcer;
    private final EventBus eventBus;
    private final HttpClient httpClient;
    private final Duration httpTimeout;

    public WorkflowEngine(KvStore kvStore, LogSink logSink, PermissionEnforcer permissionEnforcer, EventBus eventBus, Duration httpTimeout) {
        this.kvStore = Objects.requireNonNull(kvStore, "kvStore");
        this.logSink = Objects.requireNonNull(logSink, "logSink");
        this.permissionEnforcer = Objects.requireNonNull(permissionEnforcer, "permissionEnforcer");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.httpTimeout = Objects.requireNonNull(httpTimeout, "httpTimeout");
        // redirects would bypass the connect allow-list
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(httpTimeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    }

    public Result<WorkflowResult> execute(Workflow workflow, WorkflowContext context) {
        return execute(workflow, context, WorkflowProgressListener.NONE);
    }

    public Result<WorkflowResult> execute(Workflow workflow, WorkflowContext context, WorkflowProgressListener listener) {
        return Result.capture(() -> run(workflow, context, listener == null ? WorkflowProgressListener.NONE : listener));
    }

    public CompletableFuture<Result<WorkflowResult>> executeAsync(Workflow workflow, WorkflowContext context, WorkflowProgressListener listener, Executor executor) {
        return CompletableFuture.supplyAsync(() -> execute(workflow, context, listener), executor);
    }

    private WorkflowResult run(Workflow workflow, WorkflowContext ctx, WorkflowProgressListener listener) throws InterruptedException {
        Objects.requireNonNull(workflow, "workflow");
        Objects.requireNonNull(ctx, "context");
        workflow.validate();

        var steps = workflow.steps();
        int total = steps.size();
        int start = ctx.nextStepIndex();
        emit(ctx, LogLevel.INFO, start == 0
            ? "Starting workflow " + workflow.id()
            : "Resuming workflow " + workflow.id() + " at step " + (start + 1) + "/" + total);
        publish(listener, WorkflowProgress.of(workflow.id(), start, total, start == 0 ? "Starting workflow" : "Resuming workflow"));

        for (int index = start; index < total; index++) {
            if (ctx.isCancelled()) {
                emit(ctx, LogLevel.WARN, "Workflow " + workflow.id() + " cancelled before step " + steps.get(index).id());
                publish(listener, WorkflowProgress.of(workflow.id(), index, total, "Cancelled"));
                ctx.ensureNotCancelled(workflow.id());
            }
            var step = steps.get(index);
            emit(ctx, LogLevel.DEBUG, "Executing step " + (index + 1) + "/" + total + ": " + step.id() + " (" + step.type().wireName() + ")");
            publish(listener, WorkflowProgress.of(workflow.id(), index, total, "Executing step: " + step.id()));

            var started = Instant.now();
            Object value;
            try {
                value = executeStep(workflow, step, ctx);
            } catch (InterruptedException ex) {
                ctx.record(StepResult.failure(step, HostErrors.toMap(ex), started));
                throw ex;
            } catch (WorkflowCancelledException ex) {
                emit(ctx, LogLevel.WARN, "Workflow " + workflow.id() + " cancelled during step " + step.id());
                publish(listener, WorkflowProgress.of(workflow.id(), index, total, "Cancelled"));
                throw ex;
            } catch (Exception ex) {
                ctx.record(StepResult.failure(step, HostErrors.toMap(ex), started));
                emit(ctx, LogLevel.ERROR, "Step " + step.id() + " failed: " + HostErrors.normalize(ex).getMessage());
                publish(listener, WorkflowProgress.of(workflow.id(), index + 1, total, "Failed at step: " + step.id()));
                throw new WorkflowStepFailureException(step.id(), ex, ctx.successfulResults());
            }
            ctx.record(StepResult.success(step, value, started));
            ctx.advanceTo(index + 1);
            publish(listener, WorkflowProgress.of(workflow.id(), index + 1, total, "Completed step: " + step.id()));
        }

        emit(ctx, LogLevel.INFO, "Workflow " + workflow.id() + " completed");
        publish(listener, WorkflowProgress.of(workflow.id(), total, total, "Workflow completed"));
        return new WorkflowResult(workflow.id(), ctx.packId(), ctx.instanceId(), ctx.successfulResults());
    }

    private Object executeStep(Workflow workflow, WorkflowStep step, WorkflowContext ctx) throws Exception {
        return switch (step.type()) {
            case HTTP_REQUEST -> httpRequest((WorkflowStep.HttpRequest) step, ctx);
            case SANDBOX_CALL -> sandboxCall((WorkflowStep.SandboxCall) step, ctx);
            case KV_PUT -> kvPut((WorkflowStep.KvPut) step, ctx);
            case KV_GET -> kvGet((WorkflowStep.KvGet) step, ctx);
            case LOG -> logMessage((WorkflowStep.Log) step, ctx);
            case SLEEP -> sleep(workflow, (WorkflowStep.Sleep) step, ctx);
            case EMIT_EVENT -> emitEvent(workflow, (WorkflowStep.EmitEvent) step, ctx);
        };
    }

    private Map<String, Object> httpRequest(WorkflowStep.HttpRequest step, WorkflowContext ctx) throws InterruptedException {
        URI uri;
        try {
            uri = URI.create(step.url());
        } catch (IllegalArgumentException ex) {
            throw new PackHostException("invalid_url", "Invalid URL in step " + step.id() + ": " + step.url(), null, ex);
        }
        permissionEnforcer.checkConnect(ctx.packId(), ctx.permissions(), uri);

        var builder = HttpRequest.newBuilder(uri).timeout(httpTimeout);
        step.headers().forEach(builder::header);
        var body = step.body();
        if (body == null) {
            builder.method(step.method(), HttpRequest.BodyPublishers.noBody());
        } else {
            if (!(body instanceof String) && step.headers().keySet().stream().noneMatch("content-type"::equalsIgnoreCase)) {
                builder.header("Content-Type", "application/json");
            }
            builder.method(step.method(), HttpRequest.BodyPublishers.ofString(body instanceof String text ? text : toJson(body)));
        }
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException ex) {
            throw new PackHostException("http_request_failed", step.method() + " " + uri + " failed: " + ex.getMessage(), null, ex);
        }
        var headers = new LinkedHashMap<String, Object>();
        response.headers().map().forEach((name, values) -> headers.put(name, values.size() == 1 ? values.get(0) : values));
        var result = new LinkedHashMap<String, Object>();
        result.put("status", response.statusCode());
        result.put("body", response.body());
        result.put("headers", headers);
        return result;
    }

    private Object sandboxCall(WorkflowStep.SandboxCall step, WorkflowContext ctx) {
        var session = ctx.sandbox().orElseThrow(() -> new SandboxUnavailableException("No sandbox is attached to workflow run of " + ctx.packId()));
        Object input = step.inputFrom() == null ? null : ctx.resolveReference(step.inputFrom());
        var output = session.call(step.module(), step.function(), toArgsJson(input));
        return fromJson(output);
    }

    private Map<String, Object> kvPut(WorkflowStep.KvPut step, WorkflowContext ctx) {
        kvStore.put(ctx.packId(), step.key(), toJson(step.value()));
        return Map.of("key", step.key());
    }

    private Object kvGet(WorkflowStep.KvGet step, WorkflowContext ctx) {
        return kvStore.get(ctx.packId(), step.key()).map(WorkflowEngine::fromJson).orElse(null);
    }

    private Object logMessage(WorkflowStep.Log step, WorkflowContext ctx) {
        logSink.log(ctx.instanceId(), ctx.packId(), step.level(), step.message(), LogSource.WORKFLOW_STEP);
        return null;
    }

    /**
     * A cancelled sleep is not completed: the time left is kept on the context and a resumed run
     * sleeps only that remainder.
     */
    private Map<String, Object> sleep(Workflow workflow, WorkflowStep.Sleep step, WorkflowContext ctx) throws InterruptedException {
        var duration = ctx.remainingSleep(step.id(), step.duration());
        var started = System.nanoTime();
        boolean woken = ctx.cancellationToken().await(duration);
        var slept = Duration.ofNanos(System.nanoTime() - started);
        if (woken) {
            ctx.deferSleep(step.id(), duration.minus(slept));
            ctx.ensureNotCancelled(workflow.id());
        }
        boolean resumed = ctx.clearSleep(step.id());
        var result = new LinkedHashMap<String, Object>();
        result.put("slept_ms", slept.toMillis());
        result.put("resumed", resumed);
        return result;
    }

    private Map<String, Object> emitEvent(Workflow workflow, WorkflowStep.EmitEvent step, WorkflowContext ctx) {
        eventBus.publish(new WorkflowEvent(step.eventType(), ctx.packId(), ctx.instanceId(), workflow.id(), step.id(), step.payload(), Instant.now()));
        return Map.of("event_type", step.eventType());
    }

    private void emit(WorkflowContext ctx, LogLevel level, String message) {
        try {
            logSink.log(ctx.instanceId(), ctx.packId(), level, message, LogSource.WORKFLOW_STEP);
        } catch (RuntimeException ex) {
            log.warn("Log sink rejected workflow message for {}: {}", ctx.packId(), ex.getMessage());
        }
    }

    private static void publish(WorkflowProgressListener listener, WorkflowProgress progress) {
        try {
            listener.onProgress(progress);
        } catch (RuntimeException ex) {
            log.warn("Progress listener failed: {}", ex.getMessage());
        }
    }

    static String toArgsJson(Object input) {
        if (input == null) {
            return "{}";
        }
        if (input instanceof String text) {
            try {
                Json.mapper().readTree(text);
                return text;
            } catch (JsonProcessingException ex) {
                return toJson(text);
            }
        }
        return toJson(input);
    }

    static String toJson(Object value) {
        try {
            return Json.mapper().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new PackHostException("serialization_failed", "Value is not serialisable as JSON: " + ex.getOriginalMessage(), null, ex);
        }
    }

    static Object fromJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return Json.mapper().readValue(json, Object.class);
        } catch (JsonProcessingException ex) {
            return json;
        }
    }
}
