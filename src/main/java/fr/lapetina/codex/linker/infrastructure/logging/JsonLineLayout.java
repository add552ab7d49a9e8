package fr.lapetina.codex.linker.infrastructure.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Renders each event as one JSON object per line, using the same fields as
 * the remote log records.
 */
public final class JsonLineLayout extends LayoutBase<ILoggingEvent> {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    @Override
    public String doLayout(ILoggingEvent event) {
        try {
            return objectMapper.writeValueAsString(LogEventConverter.toRecord(event)) + CoreConstants.LINE_SEPARATOR;
        } catch (JsonProcessingException e) {
            addError("Failed to serialize log event", e);
            return "{\"level\":\"" + event.getLevel() + "\",\"message\":\"unserializable log event\"}"
                    + CoreConstants.LINE_SEPARATOR;
        }
    }

    @Override
    public String getContentType() {
        return "application/json";
    }
}
