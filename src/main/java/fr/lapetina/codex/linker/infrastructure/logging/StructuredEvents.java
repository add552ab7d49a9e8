package fr.lapetina.codex.linker.infrastructure.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;
import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits log statements carrying structured fields.
 *
 * <p>Fields travel in the SLF4J {@link MDC} for the duration of a single log call, so every
 * appender (console, JSON, remote) sees them. Keys already present in the MDC are restored
 * afterwards.
 *
 * <pre>{@code
 * StructuredEvents.event("detect_success")
 *         .provider("ollama")
 *         .path("/models")
 *         .durationMs(42)
 *         .log(log, Level.INFO, "Detected {}", baseUrl);
 * }</pre>
 */
public final class StructuredEvents {

    public static final String EVENT = "event";
    public static final String PROVIDER = "provider";
    public static final String MODEL = "model";
    public static final String PATH = "path";
    public static final String DURATION_MS = "duration_ms";
    public static final String ERROR_TYPE = "error_type";

    private final Map<String, String> fields = new LinkedHashMap<>();

    private StructuredEvents(String event) {
        put(EVENT, event);
    }

    public static StructuredEvents event(String event) {
        return new StructuredEvents(event);
    }

    public StructuredEvents provider(String provider) {
        return put(PROVIDER, provider);
    }

    public StructuredEvents model(String model) {
        return put(MODEL, model);
    }

    public StructuredEvents path(String path) {
        return put(PATH, path);
    }

    public StructuredEvents durationMs(long durationMs) {
        return put(DURATION_MS, Long.toString(durationMs));
    }

    public StructuredEvents errorType(String errorType) {
        return put(ERROR_TYPE, errorType);
    }

    private StructuredEvents put(String key, String value) {
        if (value != null) {
            fields.put(key, value);
        }
        return this;
    }

    /**
     * Logs the message with the collected fields in the MDC.
     */
    public void log(Logger logger, Level level, String format, Object... arguments) {
        if (!logger.isEnabledForLevel(level)) {
            return;
        }
        List<Map.Entry<String, String>> previous = new ArrayList<>();
        for (Map.Entry<String, String> field : fields.entrySet()) {
            previous.add(Map.entry(field.getKey(), nullToEmpty(MDC.get(field.getKey()))));
            MDC.put(field.getKey(), field.getValue());
        }
        try {
            logger.atLevel(level).log(format, arguments);
        } finally {
            for (Map.Entry<String, String> entry : previous) {
                if (entry.getValue().isEmpty()) {
                    MDC.remove(entry.getKey());
                } else {
                    MDC.put(entry.getKey(), entry.getValue());
                }
            }
        }
    }

    Map<String, String> fields() {
        return Map.copyOf(fields);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
