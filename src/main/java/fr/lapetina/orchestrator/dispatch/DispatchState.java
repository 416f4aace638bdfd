package fr.lapetina.orchestrator.dispatch;

import fr.lapetina.orchestrator.domain.model.ErrorType;

/**
 * Lifecycle state of a dispatch walking its provider list.
 */
public enum DispatchState {
    /** A provider call is in flight, retries included */
    ATTEMPTING,

    /** A provider succeeded; no further provider is tried */
    SUCCESS,

    /** A provider failed and the next one will be tried */
    FALLBACK,

    /** A provider failed and no further provider may be tried */
    EXHAUSTED,

    /** Configuration prevents any attempt, e.g. no provider enabled or missing credential */
    REJECTED;

    public boolean isTerminal() {
        return this == SUCCESS || this == EXHAUSTED || this == REJECTED;
    }

    /**
     * State reached once a provider attempt settled.
     *
     * @param success         whether the provider eventually succeeded
     * @param errorType       failure classification, ignored on success
     * @param allowFallback   whether the resolution permits trying other providers
     * @param hasNextProvider whether a provider remains after the current one
     */
    public static DispatchState afterAttempt(
            boolean success,
            ErrorType errorType,
            boolean allowFallback,
            boolean hasNextProvider
    ) {
        if (success) {
            return SUCCESS;
        }
        if (errorType == ErrorType.CONFIGURATION) {
            return REJECTED;
        }
        if (!allowFallback || !hasNextProvider) {
            return EXHAUSTED;
        }
        return FALLBACK;
    }
}
