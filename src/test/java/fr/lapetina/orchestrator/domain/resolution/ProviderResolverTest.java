package fr.lapetina.orchestrator.domain.resolution;

import fr.lapetina.orchestrator.domain.model.Provider;
import fr.lapetina.orchestrator.domain.model.ProviderPreferences;
import fr.lapetina.orchestrator.infrastructure.health.ProviderRegistry;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderResolverTest {

    private ProviderRegistry registry;
    private InMemoryPreferenceStore store;
    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry(List.of(
                provider("openai", 10, true),
                provider("anthropic", 20, true),
                provider("google", 30, true),
                provider("mistral", 5, false)
        ));
        store = new InMemoryPreferenceStore();
        metrics = new MetricsRegistry("test", false);
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    private static Provider provider(String id, int priority, boolean enabled) {
        return Provider.builder().id(id).name(id).routingPath(id).priority(priority).enabled(enabled).build();
    }

    private static List<String> ids(ProviderResolution resolution) {
        return resolution.providers().stream().map(Provider::getId).toList();
    }

    private double fallbackCount(String reason) {
        return metrics.getRegistry().find("test_preference_fallback_total").tag("reason", reason).counters()
                .stream().mapToDouble(c -> c.count()).sum();
    }

    @Test
    @DisplayName("should use enabled providers in priority order for anonymous callers")
    void shouldUseEnvironmentDefaultsForAnonymous() {
        ProviderResolver resolver = new ProviderResolver(registry, store, true, metrics);

        ProviderResolution resolution = resolver.resolve(null).join();

        assertThat(ids(resolution)).containsExactly("openai", "anthropic", "google");
        assertThat(resolution.allowFallback()).isTrue();
        assertThat(resolution.source()).isEqualTo(ProviderResolution.Source.ENVIRONMENT);
    }

    @Test
    @DisplayName("should carry the environment fallback flag when disabled")
    void shouldCarryEnvironmentFallbackFlag() {
        ProviderResolver resolver = new ProviderResolver(registry, store, false, metrics);

        ProviderResolution resolution = resolver.resolve("user-1").join();

        assertThat(resolution.allowFallback()).isFalse();
        assertThat(resolution.source()).isEqualTo(ProviderResolution.Source.ENVIRONMENT);
    }

    @Test
    @DisplayName("should put the selected provider first, then the user's fallbacks")
    void shouldHonorUserPreferences() {
        store.savePreferences("user-1", new ProviderPreferences("google", List.of("openai"), true));
        ProviderResolver resolver = new ProviderResolver(registry, store, false, metrics);

        ProviderResolution resolution = resolver.resolve("user-1").join();

        assertThat(ids(resolution)).containsExactly("google", "openai");
        assertThat(resolution.allowFallback()).isTrue();
        assertThat(resolution.source()).isEqualTo(ProviderResolution.Source.USER_PREFERENCES);
    }

    @Test
    @DisplayName("should drop duplicates, unknown and disabled providers from preferences")
    void shouldFilterPreferences() {
        store.savePreferences("user-1", new ProviderPreferences(
                "anthropic", List.of("mistral", "anthropic", "unknown", "openai"), false));
        ProviderResolver resolver = new ProviderResolver(registry, store, true, metrics);

        ProviderResolution resolution = resolver.resolve("user-1").join();

        assertThat(ids(resolution)).containsExactly("anthropic", "openai");
        assertThat(resolution.allowFallback()).isFalse();
    }

    @Test
    @DisplayName("should fall back to environment defaults when no preferred provider is enabled")
    void shouldFallBackWhenNoPreferredProviderEnabled() {
        store.savePreferences("user-1", new ProviderPreferences("mistral", List.of(), false));
        ProviderResolver resolver = new ProviderResolver(registry, store, true, metrics);

        ProviderResolution resolution = resolver.resolve("user-1").join();

        assertThat(ids(resolution)).containsExactly("openai", "anthropic", "google");
        assertThat(resolution.allowFallback()).isTrue();
        assertThat(fallbackCount("no_enabled_preference")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should degrade to environment defaults when the lookup fails")
    void shouldDegradeOnLookupFailure() {
        PreferenceStore failing = userId -> CompletableFuture.failedFuture(new IllegalStateException("db down"));
        ProviderResolver resolver = new ProviderResolver(registry, failing, true, metrics);

        ProviderResolution resolution = resolver.resolve("user-1").join();

        assertThat(resolution.source()).isEqualTo(ProviderResolution.Source.ENVIRONMENT);
        assertThat(ids(resolution)).containsExactly("openai", "anthropic", "google");
        assertThat(fallbackCount("lookup_failed")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should degrade when the store throws synchronously")
    void shouldDegradeOnSynchronousThrow() {
        PreferenceStore throwing = userId -> {
            throw new IllegalStateException("no connection");
        };
        ProviderResolver resolver = new ProviderResolver(registry, throwing, true, metrics);

        ProviderResolution resolution = resolver.resolve("user-1").join();

        assertThat(resolution.source()).isEqualTo(ProviderResolution.Source.ENVIRONMENT);
    }

    @Test
    @DisplayName("should not consult the store for blank user ids")
    void shouldSkipStoreForBlankUser() {
        AtomicInteger lookups = new AtomicInteger();
        PreferenceStore counting = userId -> {
            lookups.incrementAndGet();
            return CompletableFuture.completedFuture(java.util.Optional.empty());
        };
        ProviderResolver resolver = new ProviderResolver(registry, counting, true, metrics);

        resolver.resolve("  ").join();
        resolver.resolve("user-1").join();

        assertThat(lookups.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("should resolve to an empty list when nothing is enabled")
    void shouldResolveEmptyWhenNothingEnabled() {
        ProviderRegistry empty = new ProviderRegistry(List.of(provider("mistral", 5, false)));
        ProviderResolver resolver = new ProviderResolver(empty, store, true, metrics);

        assertThat(resolver.resolve(null).join().isEmpty()).isTrue();
    }
}
