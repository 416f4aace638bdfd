package fr.lapetina.orchestrator.domain.exception;

import fr.lapetina.orchestrator.domain.model.ErrorType;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Typed failure of a provider call or of a whole dispatch.
 *
 * Carries the error classification, the HTTP status when the failure came
 * from an HTTP exchange, and the provider that produced it.
 */
public class ProviderException extends RuntimeException {

    private final ErrorType errorType;
    private final Integer statusCode;
    private final String providerId;

    public ProviderException(ErrorType errorType, String message) {
        this(errorType, message, null, null, null);
    }

    public ProviderException(ErrorType errorType, String message, Throwable cause) {
        this(errorType, message, null, null, cause);
    }

    public ProviderException(
            ErrorType errorType,
            String message,
            Integer statusCode,
            String providerId,
            Throwable cause
    ) {
        super(message, cause);
        this.errorType = Objects.requireNonNull(errorType, "Error type is required");
        this.statusCode = statusCode;
        this.providerId = providerId;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public OptionalInt getStatusCode() {
        return statusCode != null ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }

    public String getProviderId() {
        return providerId;
    }

    /**
     * Creates a configuration error, e.g. no provider enabled.
     */
    public static ProviderException configuration(String message) {
        return new ProviderException(ErrorType.CONFIGURATION, message);
    }

    /**
     * Creates an error from an HTTP status returned by a provider.
     * 429 and 5xx are transient, everything else is fatal.
     */
    public static ProviderException fromStatus(String providerId, int statusCode, String message) {
        ErrorType type = (statusCode == 429 || statusCode == 408 || statusCode >= 500)
                ? ErrorType.TRANSIENT
                : ErrorType.FATAL;
        return new ProviderException(type, message, statusCode, providerId, null);
    }

    /**
     * Wraps an arbitrary throwable, keeping it as-is when it already is a ProviderException.
     */
    public static ProviderException wrap(Throwable throwable, String providerId) {
        Throwable cause = unwrap(throwable);
        if (cause instanceof ProviderException pe) {
            return pe;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        ErrorType type = cause instanceof java.io.IOException ? ErrorType.TRANSIENT : ErrorType.FATAL;
        return new ProviderException(type, message, null, providerId, cause);
    }

    /**
     * Strips CompletionException/ExecutionException layers.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof java.util.concurrent.CompletionException
                || current instanceof java.util.concurrent.ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
