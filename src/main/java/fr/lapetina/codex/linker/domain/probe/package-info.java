/**
 * Probe strategy used by endpoint detection.
 *
 * <p>The {@link fr.lapetina.codex.linker.domain.probe.Probe} interface is injected into
 * {@link fr.lapetina.codex.linker.detection.EndpointRace}; production code uses
 * {@link fr.lapetina.codex.linker.infrastructure.http.HttpProbe}, tests pass lambdas.
 */
package fr.lapetina.codex.linker.domain.probe;
