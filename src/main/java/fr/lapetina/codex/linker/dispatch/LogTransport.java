package fr.lapetina.codex.linker.dispatch;

import fr.lapetina.codex.linker.domain.model.LogRecord;

/**
 * Destination of shipped log records.
 *
 * {@link #send} is called from a single dispatcher worker thread (or from the
 * producer thread in synchronous mode) and may block on network I/O. Failures
 * are reported by throwing; the dispatcher discards the record.
 */
@FunctionalInterface
public interface LogTransport extends AutoCloseable {

    /**
     * Delivers one record.
     *
     * @throws Exception if delivery failed
     */
    void send(LogRecord record) throws Exception;

    /**
     * Releases transport resources. Called at most once by the dispatcher.
     */
    @Override
    default void close() {
        // Default no-op
    }
}
