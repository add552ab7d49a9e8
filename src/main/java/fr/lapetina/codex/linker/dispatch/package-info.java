/**
 * Asynchronous remote log shipping.
 *
 * <p>Log calls must never stall the interactive CLI on a slow or unreachable log
 * server. Records flow through a bounded queue drained by a single worker:
 *
 * <pre>
 * producer threads ─enqueue→ [bounded FIFO, drop-oldest] ─worker→ LogTransport
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.codex.linker.dispatch.LogDispatcher} - Queue, worker and drain protocol</li>
 *   <li>{@link fr.lapetina.codex.linker.dispatch.LogTransport} - Delivery strategy injected into the dispatcher</li>
 * </ul>
 *
 * @see fr.lapetina.codex.linker.infrastructure.http.HttpLogTransport
 * @see fr.lapetina.codex.linker.infrastructure.logging.RemoteLogAppender
 */
package fr.lapetina.codex.linker.dispatch;
