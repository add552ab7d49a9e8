package fr.lapetina.codex.linker.infrastructure.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import fr.lapetina.codex.linker.domain.model.LogRecord;
import org.slf4j.event.Level;

import java.time.Instant;
import java.util.Map;

/**
 * Converts Logback events into {@link LogRecord}s, lifting the structured
 * fields out of the event's MDC.
 */
final class LogEventConverter {

    private LogEventConverter() {
    }

    static LogRecord toRecord(ILoggingEvent event) {
        Map<String, String> mdc = event.getMDCPropertyMap();

        String errorType = mdc.get(StructuredEvents.ERROR_TYPE);
        IThrowableProxy throwable = event.getThrowableProxy();
        if (errorType == null && throwable != null) {
            errorType = simpleName(throwable.getClassName());
        }

        return LogRecord.builder()
                .level(toSlf4jLevel(event.getLevel()))
                .message(event.getFormattedMessage())
                .event(mdc.get(StructuredEvents.EVENT))
                .provider(mdc.get(StructuredEvents.PROVIDER))
                .model(mdc.get(StructuredEvents.MODEL))
                .path(mdc.get(StructuredEvents.PATH))
                .durationMs(parseLong(mdc.get(StructuredEvents.DURATION_MS)))
                .errorType(errorType)
                .logger(event.getLoggerName())
                .timestamp(Instant.ofEpochMilli(event.getTimeStamp()))
                .build();
    }

    static Level toSlf4jLevel(ch.qos.logback.classic.Level level) {
        if (level == null) {
            return Level.INFO;
        }
        return switch (level.toInt()) {
            case ch.qos.logback.classic.Level.ERROR_INT -> Level.ERROR;
            case ch.qos.logback.classic.Level.WARN_INT -> Level.WARN;
            case ch.qos.logback.classic.Level.DEBUG_INT -> Level.DEBUG;
            case ch.qos.logback.classic.Level.TRACE_INT -> Level.TRACE;
            default -> Level.INFO;
        };
    }

    private static Long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String simpleName(String className) {
        int dot = className.lastIndexOf('.');
        return dot >= 0 ? className.substring(dot + 1) : className;
    }
}
