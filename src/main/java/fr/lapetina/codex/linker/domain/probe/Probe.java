package fr.lapetina.codex.linker.domain.probe;

import fr.lapetina.codex.linker.domain.model.Candidate;
import fr.lapetina.codex.linker.domain.model.ProbeOutcome;

import java.time.Duration;

/**
 * Strategy for checking whether a candidate endpoint serves an
 * OpenAI-compatible API.
 *
 * Implementations must be thread-safe as one instance is invoked from
 * several race workers concurrently. They must not throw: every failure is
 * reported as a failed {@link ProbeOutcome}.
 */
@FunctionalInterface
public interface Probe {

    /**
     * Issues one bounded-time request against the candidate.
     *
     * @param candidate Endpoint to check
     * @param timeout   Upper bound for the whole request
     * @return Classified outcome, never null
     */
    ProbeOutcome probe(Candidate candidate, Duration timeout);
}
