package fr.lapetina.orchestrator.domain.resolution;

import fr.lapetina.orchestrator.domain.model.Provider;

import java.util.List;

/**
 * Ordered candidates of one dispatch and whether the dispatcher may move past the first failure.
 *
 * @param providers     candidates in the order they must be tried, possibly empty
 * @param allowFallback whether to continue with the next provider after a failure
 * @param source        where the order came from
 */
public record ProviderResolution(
        List<Provider> providers,
        boolean allowFallback,
        Source source
) {
    public ProviderResolution {
        providers = List.copyOf(providers);
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }

    public enum Source {
        /** Order and fallback flag from the user's stored preferences */
        USER_PREFERENCES,

        /** Statically enabled providers in priority order, environment fallback flag */
        ENVIRONMENT
    }
}
