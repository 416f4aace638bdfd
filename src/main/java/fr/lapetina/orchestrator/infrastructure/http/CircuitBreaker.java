package fr.lapetina.orchestrator.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-provider circuit breaker guarding the gateway transport.
 *
 * States:
 * - CLOSED: calls pass through, consecutive failures are counted
 * - OPEN: calls are rejected until the recovery timeout elapsed
 * - HALF_OPEN: trial calls pass; enough successes close, any failure reopens
 *
 * Lock-free, based on atomic compare-and-set.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String providerId;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int successThresholdInHalfOpen;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicInteger halfOpenSuccesses = new AtomicInteger(0);
    private volatile Instant openedAt;

    public CircuitBreaker(
            String providerId,
            int failureThreshold,
            Duration recoveryTimeout,
            int successThresholdInHalfOpen,
            Clock clock
    ) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1: " + failureThreshold);
        }
        this.providerId = providerId;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.successThresholdInHalfOpen = Math.max(1, successThresholdInHalfOpen);
        this.clock = clock;
    }

    public CircuitBreaker(String providerId, int failureThreshold, Duration recoveryTimeout) {
        this(providerId, failureThreshold, recoveryTimeout, 2, Clock.systemUTC());
    }

    /**
     * @return true if a call may go out, false while the circuit is open
     */
    public boolean allowRequest() {
        return switch (getState()) {
            case CLOSED, HALF_OPEN -> true;
            case OPEN -> false;
        };
    }

    public void recordSuccess() {
        State current = state.get();
        if (current == State.CLOSED) {
            consecutiveFailures.set(0);
            return;
        }
        if (current == State.HALF_OPEN
                && halfOpenSuccesses.incrementAndGet() >= successThresholdInHalfOpen
                && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
            consecutiveFailures.set(0);
            log.info("Circuit breaker CLOSED after recovery: providerId={}", providerId);
        }
    }

    public void recordFailure() {
        State current = state.get();
        if (current == State.HALF_OPEN) {
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit breaker OPENED (half-open failure): providerId={}", providerId);
            }
            return;
        }
        if (current == State.CLOSED) {
            int failures = consecutiveFailures.incrementAndGet();
            if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit breaker OPENED: providerId={}, consecutiveFailures={}", providerId, failures);
            }
        }
    }

    /**
     * Current state; an open circuit whose recovery timeout elapsed moves to HALF_OPEN.
     */
    public State getState() {
        if (state.get() == State.OPEN) {
            Instant opened = openedAt;
            if (opened != null && !clock.instant().isBefore(opened.plus(recoveryTimeout))
                    && state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
                halfOpenSuccesses.set(0);
                log.info("Circuit breaker transitioning to HALF_OPEN: providerId={}", providerId);
            }
        }
        return state.get();
    }

    /**
     * Forces the circuit back to CLOSED. Admin use.
     */
    public void reset() {
        State old = state.getAndSet(State.CLOSED);
        consecutiveFailures.set(0);
        halfOpenSuccesses.set(0);
        log.info("Circuit breaker reset from {}: providerId={}", old, providerId);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public String getProviderId() {
        return providerId;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "providerId='" + providerId + '\'' +
                ", state=" + state.get() +
                ", consecutiveFailures=" + consecutiveFailures.get() +
                '}';
    }
}
