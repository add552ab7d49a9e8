/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing. Command line options are applied
 * on top of the loaded values by the application entry point.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.codex.linker.infrastructure.config.LinkerConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.codex.linker.infrastructure.config.ConfigLoader} - YAML loading from file or classpath</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code detection} - Candidate base URLs, probe timeout and models path</li>
 *   <li>{@code logging} - Console level, file and JSON output, remote shipping queue</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.codex.linker.infrastructure.config;
