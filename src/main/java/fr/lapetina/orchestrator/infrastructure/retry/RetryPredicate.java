package fr.lapetina.orchestrator.infrastructure.retry;

/**
 * Decides whether a failed attempt may be repeated against the same provider.
 */
@FunctionalInterface
public interface RetryPredicate {

    /**
     * @param error the failure of the last attempt, already unwrapped from
     *              {@code CompletionException} layers
     * @return true if another attempt is worth making
     */
    boolean isRetryable(Throwable error);
}
