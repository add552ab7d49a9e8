package fr.lapetina.codex.linker.infrastructure.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import fr.lapetina.codex.linker.dispatch.LogDispatcher;
import fr.lapetina.codex.linker.infrastructure.http.HttpLogTransport;

/**
 * Logback appender that hands every event to a {@link LogDispatcher}.
 *
 * <p>{@code append} only converts and enqueues, so logging threads never wait on the
 * network. Events from the dispatch machinery itself are skipped to avoid shipping
 * the shipper's own diagnostics.
 */
public final class RemoteLogAppender extends AppenderBase<ILoggingEvent> {

    public static final String APPENDER_NAME = "CODEX_LINKER_REMOTE";

    private static final String DISPATCH_PACKAGE = LogDispatcher.class.getPackageName();
    private static final String TRANSPORT_LOGGER = HttpLogTransport.class.getName();

    private final LogDispatcher dispatcher;

    public RemoteLogAppender(LogDispatcher dispatcher) {
        this.dispatcher = dispatcher;
        setName(APPENDER_NAME);
    }

    @Override
    protected void append(ILoggingEvent event) {
        if (event == null || isInternal(event.getLoggerName())) {
            return;
        }
        dispatcher.enqueue(LogEventConverter.toRecord(event));
    }

    private static boolean isInternal(String loggerName) {
        return loggerName != null
                && (loggerName.startsWith(DISPATCH_PACKAGE) || loggerName.equals(TRANSPORT_LOGGER));
    }
}
