package fr.lapetina.orchestrator.infrastructure.health;

import fr.lapetina.orchestrator.domain.model.HealthSample;
import fr.lapetina.orchestrator.domain.model.Provider;

import java.util.concurrent.CompletableFuture;

/**
 * Lightweight liveness check of a provider, used by the background health loop.
 */
@FunctionalInterface
public interface ProviderProbe {

    /**
     * Probes the provider. The future may complete exceptionally; the health
     * monitor turns failures into failed samples.
     */
    CompletableFuture<HealthSample> probe(Provider provider);
}
