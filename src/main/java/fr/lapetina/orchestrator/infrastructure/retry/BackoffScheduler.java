package fr.lapetina.orchestrator.infrastructure.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Suspends a logical operation without blocking the calling thread.
 */
@FunctionalInterface
public interface BackoffScheduler {

    /**
     * Returns a future completing once {@code delay} has elapsed.
     */
    CompletableFuture<Void> delay(Duration delay);
}
