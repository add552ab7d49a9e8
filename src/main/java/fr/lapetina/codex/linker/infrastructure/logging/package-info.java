/**
 * Logback integration.
 *
 * <p>{@link fr.lapetina.codex.linker.infrastructure.logging.LoggingConfigurator} applies the
 * logging options at runtime. Structured fields are carried in the SLF4J MDC by
 * {@link fr.lapetina.codex.linker.infrastructure.logging.StructuredEvents} and rendered by
 * {@link fr.lapetina.codex.linker.infrastructure.logging.JsonLineLayout} and
 * {@link fr.lapetina.codex.linker.infrastructure.logging.RemoteLogAppender}.
 */
package fr.lapetina.codex.linker.infrastructure.logging;
