package fr.lapetina.orchestrator.domain.model;

/**
 * Error taxonomy for provider calls and dispatches.
 * Drives retry and fallback decisions as well as metrics tags.
 */
public enum ErrorType {
    /** No provider enabled, or a required credential is missing. Never retried. */
    CONFIGURATION,

    /** Network failure, rate limiting or server-side failure. Retried locally. */
    TRANSIENT,

    /** Anything else: malformed request, auth rejection. Not retried, but falls back. */
    FATAL,

    /** Attempt did not complete within its time budget. Retried like a transient error. */
    TIMEOUT,

    /** Circuit breaker is open for the target provider */
    CIRCUIT_OPEN,

    /** Every resolved provider has been tried and failed */
    EXHAUSTED
}
