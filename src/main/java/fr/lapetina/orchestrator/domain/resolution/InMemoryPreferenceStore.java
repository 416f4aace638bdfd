package fr.lapetina.orchestrator.domain.resolution;

import fr.lapetina.orchestrator.domain.model.ProviderPreferences;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Preference store backed by a concurrent map.
 */
public final class InMemoryPreferenceStore implements PreferenceStore {

    private final Map<String, ProviderPreferences> preferences = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Optional<ProviderPreferences>> loadPreferences(String userId) {
        return CompletableFuture.completedFuture(Optional.ofNullable(preferences.get(userId)));
    }

    public void savePreferences(String userId, ProviderPreferences value) {
        preferences.put(userId, value);
    }

    public void removePreferences(String userId) {
        preferences.remove(userId);
    }
}
