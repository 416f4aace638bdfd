/**
 * Domain model of the orchestrator.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.orchestrator.domain.model.Provider} - An AI backend reachable through the gateway</li>
 *   <li>{@link fr.lapetina.orchestrator.domain.model.Result} - Value or typed error, never thrown across the API</li>
 *   <li>{@link fr.lapetina.orchestrator.domain.model.HealthStatus} - Provider classification (OPERATIONAL, DEGRADED, OUTAGE, UNKNOWN)</li>
 *   <li>{@link fr.lapetina.orchestrator.domain.model.ErrorType} - Failure classification driving retry and fallback</li>
 *   <li>{@link fr.lapetina.orchestrator.domain.model.AttemptRecord} - Outcome of one provider within a dispatch</li>
 * </ul>
 *
 * <p>Everything here is an immutable record or enum, except {@code Provider}
 * which is an immutable class built through its builder.
 */
package fr.lapetina.orchestrator.domain.model;
