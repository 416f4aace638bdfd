package fr.lapetina.orchestrator.domain.resolution;

import fr.lapetina.orchestrator.domain.model.ProviderPreferences;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Source of per-user provider preferences, typically a database or remote service.
 */
@FunctionalInterface
public interface PreferenceStore {

    /**
     * @return the user's preferences, empty when none are stored. The future
     * may complete exceptionally; callers degrade to defaults.
     */
    CompletableFuture<Optional<ProviderPreferences>> loadPreferences(String userId);
}
