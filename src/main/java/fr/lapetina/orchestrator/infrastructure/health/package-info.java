/**
 * Provider health monitoring.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.orchestrator.infrastructure.health.ProviderRegistry} - Statically configured providers</li>
 *   <li>{@link fr.lapetina.orchestrator.infrastructure.health.ProviderHealthMonitor} - Probe loop and rolling classification</li>
 *   <li>{@link fr.lapetina.orchestrator.infrastructure.health.ProviderProbe} - Liveness check seam</li>
 * </ul>
 *
 * <h2>Classification</h2>
 * <ul>
 *   <li>{@code UNKNOWN} - no sample recorded</li>
 *   <li>{@code OUTAGE} - nothing succeeded in the window, or the latest samples all failed</li>
 *   <li>{@code DEGRADED} - success rate or average latency outside thresholds</li>
 *   <li>{@code OPERATIONAL} - otherwise</li>
 * </ul>
 * Old samples fall out of the window, so a recovered provider returns to
 * {@code OPERATIONAL} on its own.
 */
package fr.lapetina.orchestrator.infrastructure.health;
