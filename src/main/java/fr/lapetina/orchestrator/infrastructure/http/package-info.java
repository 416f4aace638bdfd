/**
 * Outbound HTTP transport to the model gateway.
 *
 * <p>{@link fr.lapetina.orchestrator.infrastructure.http.GatewayHttpClient} implements both
 * {@link fr.lapetina.orchestrator.infrastructure.http.ProviderTransport} and the health probe.
 * Each provider is protected by its own
 * {@link fr.lapetina.orchestrator.infrastructure.http.CircuitBreaker}; an open circuit fails
 * fast with {@code CIRCUIT_OPEN}, which the dispatcher treats as a reason to fall back.
 */
package fr.lapetina.orchestrator.infrastructure.http;
