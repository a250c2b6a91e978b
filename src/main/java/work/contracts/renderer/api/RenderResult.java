package work.contracts.renderer.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a {@link ContractRenderer} invocation (usable by the CLI and embedding apps).
 *
 * @param output the rendered module, empty when the render failed
 */
public record RenderResult(
    Status status,
    Optional<String> output,
    Map<String, Object> metadata,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RenderResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RenderResult success(String output, Map<String, Object> metadata, Instant startedAt) {
        return new RenderResult(Status.SUCCESS, Optional.of(output), metadata, startedAt, Instant.now());
    }

    public static RenderResult failure(RenderException error, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", error.getMessage());
        meta.putIfAbsent("errorKind", error.kind().code());
        meta.putIfAbsent("errorCategory", error.kind().category().name().toLowerCase());
        if (error.module() != null) {
            meta.putIfAbsent("module", error.module());
        }
        return new RenderResult(Status.FAILURE, Optional.empty(), meta, startedAt, Instant.now());
    }

    public RenderResult withMetadata(String key, Object value) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put(key, value);
        return new RenderResult(status, output, meta, startedAt, finishedAt);
    }

    public String requireOutput() {
        return output.orElseThrow(() -> new IllegalStateException("Render failed: " + metadata.get("error")));
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        serializable.put("elapsedMillis", elapsed().toMillis());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
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
