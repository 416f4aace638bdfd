package fr.lapetina.orchestrator.infrastructure.retry;

import fr.lapetina.orchestrator.domain.exception.ProviderException;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs an asynchronous operation with bounded retries and exponential backoff.
 *
 * Attempts are strictly sequential: attempt n+1 is only started once attempt n
 * has failed and the backoff delay has elapsed. The returned future never
 * completes exceptionally; failures come back as {@link Result#failure}
 * carrying the error of the most recent attempt.
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final BackoffScheduler backoffScheduler;

    public RetryExecutor(BackoffScheduler backoffScheduler) {
        this.backoffScheduler = Objects.requireNonNull(backoffScheduler, "Backoff scheduler is required");
    }

    public <T> CompletableFuture<Result<T>> executeWithRetry(
            Supplier<CompletableFuture<T>> operation,
            RetryPolicy policy
    ) {
        return executeWithRetry("operation", operation, policy);
    }

    public <T> CompletableFuture<Result<T>> executeWithRetry(
            String operationName,
            Supplier<CompletableFuture<T>> operation,
            RetryPolicy policy
    ) {
        CompletableFuture<Result<T>> promise = new CompletableFuture<>();
        attempt(operationName, operation, policy, null, 1, promise);
        return promise;
    }

    /**
     * Same loop, but each attempt is abandoned when it does not complete within
     * {@code timeout}. The abandoned call may still complete later; its result is discarded.
     * The resulting error is a {@link ErrorType#TIMEOUT} whose message contains "timed out".
     */
    public <T> CompletableFuture<Result<T>> executeWithRetryAndTimeout(
            Supplier<CompletableFuture<T>> operation,
            Duration timeout,
            RetryPolicy policy
    ) {
        return executeWithRetryAndTimeout("operation", operation, timeout, policy);
    }

    public <T> CompletableFuture<Result<T>> executeWithRetryAndTimeout(
            String operationName,
            Supplier<CompletableFuture<T>> operation,
            Duration timeout,
            RetryPolicy policy
    ) {
        Objects.requireNonNull(timeout, "Timeout is required");
        CompletableFuture<Result<T>> promise = new CompletableFuture<>();
        attempt(operationName, operation, policy, timeout, 1, promise);
        return promise;
    }

    private <T> void attempt(
            String operationName,
            Supplier<CompletableFuture<T>> operation,
            RetryPolicy policy,
            Duration timeout,
            int attempt,
            CompletableFuture<Result<T>> promise
    ) {
        invoke(operation, timeout).whenComplete((value, failure) -> {
            Throwable ex = failure;
            if (ex == null && value == null) {
                ex = new ProviderException(ErrorType.FATAL, "Operation completed without a result");
            }
            if (ex == null) {
                if (attempt > 1) {
                    log.info("Operation succeeded after retry: operation={}, attempt={}/{}",
                            operationName, attempt, policy.maxAttempts());
                }
                promise.complete(Result.success(value));
                return;
            }

            ProviderException error = normalize(ex, timeout);
            boolean retryable = isRetryable(policy, error);

            if (!retryable || attempt >= policy.maxAttempts()) {
                if (retryable) {
                    log.error("Operation failed after {} attempts: operation={}, errorType={}, error={}",
                            attempt, operationName, error.getErrorType(), error.getMessage());
                } else {
                    log.debug("Non-retryable failure: operation={}, attempt={}, errorType={}, error={}",
                            operationName, attempt, error.getErrorType(), error.getMessage());
                }
                promise.complete(Result.failure(error));
                return;
            }

            Duration delay = policy.delayAfterAttempt(attempt);
            log.warn("Attempt failed, retrying in {}ms: operation={}, attempt={}/{}, errorType={}, error={}",
                    delay.toMillis(), operationName, attempt, policy.maxAttempts(),
                    error.getErrorType(), error.getMessage());

            CompletableFuture<Void> backoff;
            try {
                backoff = backoffScheduler.delay(delay);
            } catch (RuntimeException e) {
                backoff = CompletableFuture.failedFuture(e);
            }
            if (backoff == null) {
                backoff = CompletableFuture.failedFuture(
                        new IllegalStateException("Backoff scheduler returned no future"));
            }
            backoff.whenComplete((ignored, delayError) -> {
                if (delayError != null) {
                    log.error("Backoff unavailable, giving up: operation={}, attempt={}", operationName, attempt, delayError);
                    promise.complete(Result.failure(error));
                    return;
                }
                attempt(operationName, operation, policy, timeout, attempt + 1, promise);
            });
        });
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> operation, Duration timeout) {
        CompletableFuture<T> source;
        try {
            source = operation.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (source == null) {
            return CompletableFuture.failedFuture(
                    new ProviderException(ErrorType.FATAL, "Operation returned no future"));
        }
        if (timeout == null) {
            return source;
        }

        // Separate future so that the timeout does not complete the caller's future
        CompletableFuture<T> guarded = new CompletableFuture<>();
        source.whenComplete((value, ex) -> {
            if (ex != null) {
                guarded.completeExceptionally(ex);
            } else {
                guarded.complete(value);
            }
        });
        return guarded.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static ProviderException normalize(Throwable ex, Duration timeout) {
        Throwable cause = ProviderException.unwrap(ex);
        if (timeout != null && cause instanceof TimeoutException) {
            return new ProviderException(
                    ErrorType.TIMEOUT,
                    "Operation timed out after " + timeout.toMillis() + "ms",
                    cause
            );
        }
        return ProviderException.wrap(cause, null);
    }

    private static boolean isRetryable(RetryPolicy policy, ProviderException error) {
        try {
            return policy.effectivePredicate().isRetryable(error);
        } catch (RuntimeException e) {
            log.warn("Retry predicate failed, treating error as fatal: error={}", e.getMessage());
            return false;
        }
    }
}
