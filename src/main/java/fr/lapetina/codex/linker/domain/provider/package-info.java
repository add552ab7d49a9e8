/**
 * Knowledge about well-known model servers.
 *
 * <ul>
 *   <li>{@link fr.lapetina.codex.linker.domain.provider.KnownEndpoints} - Default base URLs and the auto-detection list</li>
 *   <li>{@link fr.lapetina.codex.linker.domain.provider.ProviderResolver} - Base URL to provider id mapping</li>
 * </ul>
 */
package fr.lapetina.codex.linker.domain.provider;
