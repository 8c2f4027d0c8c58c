package work.packhost.kernel.api;

import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import work.packhost.kernel.error.HostErrors;
import work.packhost.kernel.error.PackHostException;
import work.packhost.kernel.shared.Json;

/**
 * Explicit success/failure outcome returned by every public kernel operation.
 */
public record Result<T>(Status status, T value, PackHostException error, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = Json.prettyWriter();

    public Result {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(finishedAt, "finishedAt");
        if (status == Status.FAILURE) {
            Objects.requireNonNull(error, "error");
        }
    }

    public static <T> Result<T> success(T value) {
        return success(value, Instant.now());
    }

    public static <T> Result<T> success(T value, Instant startedAt) {
        return new Result<>(Status.SUCCESS, value, null, startedAt, Instant.now());
    }

    public static <T> Result<T> failure(Throwable error) {
        return failure(error, Instant.now());
    }

    public static <T> Result<T> failure(Throwable error, Instant startedAt) {
        return new Result<>(Status.FAILURE, null, HostErrors.normalize(error), startedAt, Instant.now());
    }

    /**
     * Runs {@code action} and captures its outcome. Interrupts are restored before they are reported.
     */
    public static <T> Result<T> capture(Action<T> action) {
        var started = Instant.now();
        try {
            return success(action.run(), started);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return failure(ex, started);
        } catch (Exception ex) {
            return failure(ex, started);
        }
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }

    public Optional<T> toOptional() {
        return isSuccess() ? Optional.ofNullable(value) : Optional.empty();
    }

    public T getOrThrow() {
        if (isFailure()) {
            throw error;
        }
        return value;
    }

    public String errorCode() {
        return error == null ? null : error.code();
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (isFailure()) {
            return new Result<>(Status.FAILURE, null, error, startedAt, finishedAt);
        }
        return new Result<>(Status.SUCCESS, mapper.apply(value), null, startedAt, finishedAt);
    }

    public <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        if (isFailure()) {
            return new Result<>(Status.FAILURE, null, error, startedAt, finishedAt);
        }
        return mapper.apply(value);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        if (isSuccess()) {
            serializable.put("value", value);
        } else {
            serializable.put("error", HostErrors.toMap(error));
        }
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    @FunctionalInterface
    public interface Action<T> {
        T run() throws Exception;
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
