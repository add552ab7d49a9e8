package fr.lapetina.codex.linker.domain.model;

/**
 * Lifecycle of a log dispatcher. Transitions only move forward:
 * RUNNING → DRAINING → STOPPED.
 */
public enum DispatcherState {
    /** Worker forwards queued records; enqueues are accepted */
    RUNNING,

    /** close() was called; enqueues are rejected, the queue is being emptied */
    DRAINING,

    /** Worker exited and transport closed; enqueues are no-ops */
    STOPPED
}
