package fr.lapetina.orchestrator.infrastructure.health;

import fr.lapetina.orchestrator.domain.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the statically configured providers.
 *
 * Thread-safe. Populated once at startup from configuration.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private static final Comparator<Provider> BY_PRIORITY =
            Comparator.comparingInt(Provider::getPriority).thenComparing(Provider::getId);

    private final Map<String, Provider> providers = new ConcurrentHashMap<>();

    public ProviderRegistry() {
    }

    public ProviderRegistry(Collection<Provider> initial) {
        initial.forEach(this::registerProvider);
    }

    /**
     * Registers a provider, replacing any provider with the same ID.
     */
    public void registerProvider(Provider provider) {
        Provider previous = providers.put(provider.getId(), provider);
        if (previous == null) {
            log.info("Provider registered: {}", provider);
        } else {
            log.info("Provider updated: {}", provider);
        }
    }

    public Optional<Provider> getProvider(String providerId) {
        if (providerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(providerId));
    }

    /**
     * All providers, enabled or not, in priority order.
     */
    public List<Provider> getAllProviders() {
        List<Provider> all = new ArrayList<>(providers.values());
        all.sort(BY_PRIORITY);
        return all;
    }

    /**
     * Enabled providers in priority order (lowest priority value first).
     */
    public List<Provider> getEnabledProviders() {
        return providers.values().stream()
                .filter(Provider::isEnabled)
                .sorted(BY_PRIORITY)
                .toList();
    }

    /**
     * Whether the provider exists and is enabled.
     */
    public boolean isEnabled(String providerId) {
        return getProvider(providerId).map(Provider::isEnabled).orElse(false);
    }

    public int size() {
        return providers.size();
    }
}
