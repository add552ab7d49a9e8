/**
 * Codex Linker - diagnostics core for linking coding assistants to local model servers.
 *
 * <p>Detects which OpenAI-compatible server answers on a set of candidate base URLs by racing
 * bounded-time probes in parallel, and ships structured logs to a remote endpoint without
 * ever blocking the caller.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.codex.linker.DiagnosticsFactory} - Wires probe, race, metrics and
 *       remote logging from YAML configuration</li>
 *   <li>{@link fr.lapetina.codex.linker.CodexLinkerApplication} - Command line entry point</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (DiagnosticsFactory factory = DiagnosticsFactory.create("linker.yaml")) {
 *     Optional<Candidate> server = factory.detect(List.of());
 *     server.ifPresent(c -> System.out.println(factory.listModels(c.baseUrl())));
 * }
 * }</pre>
 *
 * @see fr.lapetina.codex.linker.detection.EndpointRace
 * @see fr.lapetina.codex.linker.dispatch.LogDispatcher
 */
package fr.lapetina.codex.linker;
