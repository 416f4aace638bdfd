package fr.lapetina.orchestrator.domain.model;

import java.util.List;

/**
 * Per-user provider choice as loaded from the preference store.
 *
 * @param selectedProvider  provider the user picked first, may be null
 * @param fallbackProviders providers to try next, in order
 * @param autoFallback      whether other providers may be tried after a failure
 */
public record ProviderPreferences(
        String selectedProvider,
        List<String> fallbackProviders,
        boolean autoFallback
) {
    public ProviderPreferences {
        fallbackProviders = fallbackProviders != null ? List.copyOf(fallbackProviders) : List.of();
    }
}
