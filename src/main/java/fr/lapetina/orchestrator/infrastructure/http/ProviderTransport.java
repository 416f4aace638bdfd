package fr.lapetina.orchestrator.infrastructure.http;

import fr.lapetina.orchestrator.domain.model.Provider;
import fr.lapetina.orchestrator.domain.model.ProviderRequest;
import fr.lapetina.orchestrator.domain.model.ProviderResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound call to a provider. Failures complete the future exceptionally
 * with a {@link fr.lapetina.orchestrator.domain.exception.ProviderException}.
 */
@FunctionalInterface
public interface ProviderTransport {

    CompletableFuture<ProviderResponse> send(Provider provider, ProviderRequest request);
}
