package fr.lapetina.orchestrator.domain.model;

import fr.lapetina.orchestrator.domain.exception.ProviderException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a provider call or dispatch: either a value or a typed error.
 * Immutable and thread-safe.
 *
 * @param value      the success value, null on failure
 * @param providerId provider that produced the value, or the last one tried
 * @param error      the failure, null on success
 */
public record Result<T>(
        T value,
        String providerId,
        ProviderException error
) {
    public Result {
        if (error == null && value == null) {
            throw new IllegalArgumentException("A successful result requires a value");
        }
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public ErrorType errorType() {
        return error != null ? error.getErrorType() : null;
    }

    /**
     * Returns the value or throws the carried error.
     */
    public T getOrThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return new Result<>(null, providerId, error);
        }
        return new Result<>(mapper.apply(value), providerId, null);
    }

    public Result<T> withProvider(String newProviderId) {
        return new Result<>(value, newProviderId, error);
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(Objects.requireNonNull(value, "Value is required"), null, null);
    }

    public static <T> Result<T> success(T value, String providerId) {
        return new Result<>(Objects.requireNonNull(value, "Value is required"), providerId, null);
    }

    public static <T> Result<T> failure(ProviderException error) {
        Objects.requireNonNull(error, "Error is required");
        return new Result<>(null, error.getProviderId(), error);
    }
}
