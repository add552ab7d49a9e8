package fr.lapetina.codex.linker.domain.provider;

import java.net.URI;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Infers a provider id from an OpenAI-compatible base URL.
 *
 * Matching is done on the base URL stripped of its API version suffix
 * ({@code /v1}, {@code /v2}); the longest matching prefix wins.
 */
public final class ProviderResolver {

    public static final String AZURE = "azure";
    public static final String CUSTOM = "custom";

    private static final String AZURE_HOST_SUFFIX = ".openai.azure.com";

    private static final List<Map.Entry<String, String>> PREFIXES = KnownEndpoints.PROVIDER_IDS.entrySet()
            .stream()
            .map(e -> Map.entry(stripVersion(e.getKey()), e.getValue()))
            .sorted(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed())
            .toList();

    private ProviderResolver() {
        // Utility class
    }

    /**
     * Resolves the provider id for a base URL.
     *
     * @param baseUrl OpenAI-compatible base URL
     * @return Canonical provider id, {@code azure} for Azure OpenAI hosts, or {@code custom}
     */
    public static String resolve(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return CUSTOM;
        }
        String url = baseUrl.strip();
        for (Map.Entry<String, String> prefix : PREFIXES) {
            if (url.startsWith(prefix.getKey())) {
                return prefix.getValue();
            }
        }
        return host(url)
                .filter(h -> h.endsWith(AZURE_HOST_SUFFIX))
                .map(h -> AZURE)
                .orElse(CUSTOM);
    }

    private static Optional<String> host(String url) {
        try {
            return Optional.ofNullable(URI.create(url).getHost()).map(h -> h.toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String stripVersion(String baseUrl) {
        return baseUrl.replaceFirst("/v[12]$", "");
    }
}
