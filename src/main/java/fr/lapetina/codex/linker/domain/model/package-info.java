/**
 * Domain model classes shared by endpoint detection and log shipping.
 *
 * <p>This package contains immutable value objects only.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.codex.linker.domain.model.Candidate} - An endpoint base URL under consideration</li>
 *   <li>{@link fr.lapetina.codex.linker.domain.model.ProbeOutcome} - Classified result of one probe</li>
 *   <li>{@link fr.lapetina.codex.linker.domain.model.ProbeFailure} - Categorized probe failure types</li>
 *   <li>{@link fr.lapetina.codex.linker.domain.model.LogRecord} - Structured record shipped to the log endpoint</li>
 *   <li>{@link fr.lapetina.codex.linker.domain.model.DispatcherState} - Log dispatcher lifecycle (RUNNING, DRAINING, STOPPED)</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All records are immutable and may be handed between probe workers, the
 * dispatcher queue and its worker thread without copying.
 *
 * @see fr.lapetina.codex.linker.domain.model.ProbeOutcome
 * @see fr.lapetina.codex.linker.domain.model.LogRecord
 */
package fr.lapetina.codex.linker.domain.model;
