package fr.lapetina.orchestrator.domain.exception;

import fr.lapetina.orchestrator.domain.model.ErrorType;

import java.util.List;

/**
 * Returned when every resolved provider has been exhausted.
 *
 * The cause is the last underlying provider error; attempted providers are
 * listed in the order they were tried.
 */
public final class AggregatedDispatchException extends ProviderException {

    private final String operationName;
    private final List<String> attemptedProviders;

    public AggregatedDispatchException(
            String operationName,
            List<String> attemptedProviders,
            ProviderException lastError
    ) {
        super(
                ErrorType.EXHAUSTED,
                buildMessage(operationName, attemptedProviders, lastError),
                lastError != null ? lastError.getStatusCode().stream().boxed().findFirst().orElse(null) : null,
                lastError != null ? lastError.getProviderId() : null,
                lastError
        );
        this.operationName = operationName;
        this.attemptedProviders = List.copyOf(attemptedProviders);
    }

    public String getOperationName() {
        return operationName;
    }

    public List<String> getAttemptedProviders() {
        return attemptedProviders;
    }

    /**
     * The error reported by the last provider tried.
     */
    public ProviderException getLastError() {
        return (ProviderException) getCause();
    }

    private static String buildMessage(String operationName, List<String> attempted, ProviderException lastError) {
        String last = lastError != null ? lastError.getMessage() : "no error recorded";
        return operationName + " failed with all providers " + attempted + ": " + last;
    }
}
