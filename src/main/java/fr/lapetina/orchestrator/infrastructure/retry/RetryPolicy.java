package fr.lapetina.orchestrator.infrastructure.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry with exponential backoff.
 *
 * @param maxAttempts    total attempts including the first one
 * @param initialDelay   delay before the second attempt
 * @param multiplier     growth factor applied to each subsequent delay
 * @param maxDelay       upper bound of any single delay
 * @param retryPredicate explicit classification, null to use {@link DefaultRetryClassifier}
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialDelay,
        double multiplier,
        Duration maxDelay,
        RetryPredicate retryPredicate
) {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(100);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(5);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        Objects.requireNonNull(initialDelay, "Initial delay is required");
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative: " + initialDelay);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1: " + multiplier);
        }
        maxDelay = maxDelay != null ? maxDelay : DEFAULT_MAX_DELAY;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY, null);
    }

    /**
     * Single attempt, no retry.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO, null);
    }

    public RetryPolicy withPredicate(RetryPredicate predicate) {
        return new RetryPolicy(maxAttempts, initialDelay, multiplier, maxDelay, predicate);
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, initialDelay, multiplier, maxDelay, retryPredicate);
    }

    /**
     * Predicate in effect: the explicit one if set, the default classification otherwise.
     */
    public RetryPredicate effectivePredicate() {
        return retryPredicate != null ? retryPredicate : DefaultRetryClassifier.INSTANCE;
    }

    /**
     * Delay to wait after failed attempt {@code attempt} (1-based) before the next one:
     * {@code initialDelay * multiplier^(attempt-1)}, capped at {@code maxDelay}.
     */
    public Duration delayAfterAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based: " + attempt);
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
