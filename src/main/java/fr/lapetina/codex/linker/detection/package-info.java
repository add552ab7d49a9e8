/**
 * Auto-detection of a running OpenAI-compatible server.
 *
 * <p>{@link fr.lapetina.codex.linker.detection.EndpointRace} probes every candidate at
 * once and returns as soon as one answers, so detection takes as long as the fastest
 * healthy server rather than the sum of all timeouts.
 */
package fr.lapetina.codex.linker.detection;
