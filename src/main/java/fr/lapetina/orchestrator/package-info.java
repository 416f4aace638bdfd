/**
 * AI provider orchestrator: routes generation calls across several AI providers
 * behind one model gateway, with retries, fallback, health tracking and context caching.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.orchestrator.AiOrchestrator} - Main entry point, wires every component
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.orchestrator.OrchestratorApplication} - Standalone process with the
 *       diagnostics HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (AiOrchestrator orchestrator = AiOrchestrator.create("config.yaml").start()) {
 *     Result<ProviderResponse> result = orchestrator
 *             .dispatch("summarize", userId, "You are concise.", "Summarize chapter one")
 *             .join();
 *
 *     if (result.isSuccess()) {
 *         System.out.println(result.value().content());
 *     }
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Ordered provider fallback driven by per-user preferences</li>
 *   <li>Bounded retries with exponential backoff and a pluggable retry predicate</li>
 *   <li>Rolling-window provider health classification</li>
 *   <li>Hash-validated context cache with TTL and capacity eviction</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.orchestrator.AiOrchestrator
 * @see fr.lapetina.orchestrator.dispatch.FallbackDispatcher
 */
package fr.lapetina.orchestrator;
