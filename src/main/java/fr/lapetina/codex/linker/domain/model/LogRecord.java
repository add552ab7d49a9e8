package fr.lapetina.codex.linker.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.slf4j.event.Level;

import java.time.Instant;
import java.util.Objects;

/**
 * A structured log record shipped to the remote log endpoint.
 * Immutable and thread-safe; ownership passes to the dispatcher queue on enqueue.
 *
 * <p>Serializes to the log wire format: {@code level} and {@code message} are always
 * present, the structured fields only when set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"level", "message", "event", "provider", "model", "path",
        "duration_ms", "error_type", "logger", "timestamp"})
public record LogRecord(
        @JsonProperty("level") Level level,
        @JsonProperty("message") String message,
        @JsonProperty("event") String event,
        @JsonProperty("provider") String provider,
        @JsonProperty("model") String model,
        @JsonProperty("path") String path,
        @JsonProperty("duration_ms") Long durationMs,
        @JsonProperty("error_type") String errorType,
        @JsonProperty("logger") String logger,
        @JsonProperty("timestamp") Instant timestamp
) {
    public LogRecord {
        Objects.requireNonNull(level, "Level is required");
        if (message == null) {
            message = "";
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    /**
     * Creates a plain record without structured fields.
     */
    public static LogRecord of(Level level, String message) {
        return new LogRecord(level, message, null, null, null, null, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Level level = Level.INFO;
        private String message;
        private String event;
        private String provider;
        private String model;
        private String path;
        private Long durationMs;
        private String errorType;
        private String logger;
        private Instant timestamp;

        public Builder level(Level level) {
            this.level = level;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder event(String event) {
            this.event = event;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder durationMs(Long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder errorType(String errorType) {
            this.errorType = errorType;
            return this;
        }

        public Builder logger(String logger) {
            this.logger = logger;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public LogRecord build() {
            return new LogRecord(
                    level, message, event, provider, model, path,
                    durationMs, errorType, logger, timestamp
            );
        }
    }
}
