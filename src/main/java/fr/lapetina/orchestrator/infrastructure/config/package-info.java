/**
 * Configuration loading.
 *
 * <p>YAML configuration is read once at startup by
 * {@link fr.lapetina.orchestrator.infrastructure.config.ConfigLoader} into
 * {@link fr.lapetina.orchestrator.infrastructure.config.OrchestratorConfig}.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - Diagnostics HTTP server settings</li>
 *   <li>{@code gateway} - Model gateway URL, API key variable, timeouts, circuit breaker</li>
 *   <li>{@code providers} - Provider list with priority and enabled flag</li>
 *   <li>{@code fallback} - Environment default for cross-provider fallback</li>
 *   <li>{@code retry} - Retry policy</li>
 *   <li>{@code healthCheck} - Probe interval and classification thresholds</li>
 *   <li>{@code cache} - Context cache TTL and capacity</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.orchestrator.infrastructure.config;
