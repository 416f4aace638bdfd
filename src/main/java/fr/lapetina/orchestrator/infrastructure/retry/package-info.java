/**
 * Retry policy engine.
 *
 * <p>{@link fr.lapetina.orchestrator.infrastructure.retry.RetryExecutor} repeats an
 * asynchronous provider call under a {@link fr.lapetina.orchestrator.infrastructure.retry.RetryPolicy}.
 * Classification of failures is isolated behind
 * {@link fr.lapetina.orchestrator.infrastructure.retry.RetryPredicate}; the default
 * implementation is {@link fr.lapetina.orchestrator.infrastructure.retry.DefaultRetryClassifier}.
 *
 * <h2>Backoff</h2>
 * <p>Delays go through a {@link fr.lapetina.orchestrator.infrastructure.retry.BackoffScheduler}
 * and never block a thread. Tests substitute a scheduler that records the requested
 * delays and completes immediately.
 */
package fr.lapetina.orchestrator.infrastructure.retry;
