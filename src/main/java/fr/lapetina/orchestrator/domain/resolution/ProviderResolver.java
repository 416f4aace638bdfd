package fr.lapetina.orchestrator.domain.resolution;

import fr.lapetina.orchestrator.domain.model.Provider;
import fr.lapetina.orchestrator.domain.model.ProviderPreferences;
import fr.lapetina.orchestrator.infrastructure.health.ProviderRegistry;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Decides, per dispatch, which providers to try and in what order.
 *
 * With stored preferences, the user's selected provider comes first, followed
 * by their fallback providers; providers that are unknown or globally disabled
 * are dropped. Without usable preferences, the enabled providers are used in
 * configured priority order with the environment fallback flag. Preference
 * lookup failures are logged and counted, never returned.
 */
public final class ProviderResolver {

    private static final Logger log = LoggerFactory.getLogger(ProviderResolver.class);

    private final ProviderRegistry providerRegistry;
    private final PreferenceStore preferenceStore;
    private final boolean environmentFallbackEnabled;
    private final MetricsRegistry metricsRegistry;

    public ProviderResolver(
            ProviderRegistry providerRegistry,
            PreferenceStore preferenceStore,
            boolean environmentFallbackEnabled,
            MetricsRegistry metricsRegistry
    ) {
        this.providerRegistry = Objects.requireNonNull(providerRegistry, "Provider registry is required");
        this.preferenceStore = Objects.requireNonNull(preferenceStore, "Preference store is required");
        this.environmentFallbackEnabled = environmentFallbackEnabled;
        this.metricsRegistry = Objects.requireNonNull(metricsRegistry, "Metrics registry is required");
    }

    /**
     * Resolves the candidates for a user. The future never completes exceptionally.
     *
     * @param userId caller identity, null when anonymous
     */
    public CompletableFuture<ProviderResolution> resolve(String userId) {
        if (userId == null || userId.isBlank()) {
            return CompletableFuture.completedFuture(environmentDefault());
        }

        CompletableFuture<Optional<ProviderPreferences>> lookup;
        try {
            lookup = preferenceStore.loadPreferences(userId);
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }
        if (lookup == null) {
            lookup = CompletableFuture.completedFuture(Optional.empty());
        }

        return lookup.handle((preferences, ex) -> {
            if (ex != null) {
                log.warn("Preference lookup failed, using environment defaults: userId={}, error={}",
                        userId, ex.getMessage());
                metricsRegistry.incrementPreferenceFallback("lookup_failed");
                return environmentDefault();
            }
            if (preferences == null || preferences.isEmpty()) {
                log.debug("No stored preferences, using environment defaults: userId={}", userId);
                return environmentDefault();
            }
            return fromPreferences(userId, preferences.get());
        });
    }

    private ProviderResolution fromPreferences(String userId, ProviderPreferences preferences) {
        Set<String> requested = new LinkedHashSet<>();
        if (preferences.selectedProvider() != null) {
            requested.add(preferences.selectedProvider());
        }
        requested.addAll(preferences.fallbackProviders());

        List<Provider> ordered = new ArrayList<>(requested.size());
        for (String providerId : requested) {
            Optional<Provider> provider = providerRegistry.getProvider(providerId).filter(Provider::isEnabled);
            if (provider.isPresent()) {
                ordered.add(provider.get());
            } else {
                log.debug("Preferred provider skipped, unknown or disabled: userId={}, providerId={}", userId, providerId);
            }
        }

        if (ordered.isEmpty()) {
            log.info("No preferred provider is enabled, using environment defaults: userId={}, requested={}",
                    userId, requested);
            metricsRegistry.incrementPreferenceFallback("no_enabled_preference");
            return environmentDefault();
        }

        log.debug("Providers resolved from preferences: userId={}, providers={}, autoFallback={}",
                userId, ordered.stream().map(Provider::getId).toList(), preferences.autoFallback());
        return new ProviderResolution(ordered, preferences.autoFallback(), ProviderResolution.Source.USER_PREFERENCES);
    }

    /**
     * Enabled providers in priority order with the environment fallback flag.
     */
    public ProviderResolution environmentDefault() {
        return new ProviderResolution(
                providerRegistry.getEnabledProviders(),
                environmentFallbackEnabled,
                ProviderResolution.Source.ENVIRONMENT
        );
    }
}
