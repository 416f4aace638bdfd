/**
 * Fallback dispatch.
 *
 * <p>{@link fr.lapetina.orchestrator.dispatch.FallbackDispatcher} is the top-level
 * orchestration step: resolve once, walk the providers in order under the retry engine,
 * stop at the first success.
 *
 * <h2>State Machine</h2>
 * <pre>
 * ATTEMPTING -- success --------------------------&gt; SUCCESS
 * ATTEMPTING -- configuration error -------------&gt; REJECTED
 * ATTEMPTING -- failure, fallback off or last ---&gt; EXHAUSTED
 * ATTEMPTING -- failure, next provider available -&gt; FALLBACK -&gt; ATTEMPTING
 * </pre>
 * An empty resolution goes straight to {@code REJECTED}.
 *
 * <h2>Telemetry</h2>
 * <p>Each attempted provider yields one
 * {@link fr.lapetina.orchestrator.domain.model.AttemptRecord}, recorded in the health
 * monitor and handed to every {@link fr.lapetina.orchestrator.dispatch.AnalyticsSink}
 * on a separate executor.
 */
package fr.lapetina.orchestrator.dispatch;
