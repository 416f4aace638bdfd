package fr.lapetina.orchestrator.infrastructure.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Backoff scheduler backed by a daemon timer thread.
 *
 * The timer thread never runs continuations: an elapsed delay is handed to a
 * separate pool which completes the future, so whatever the retried operation
 * does synchronously cannot hold up the backoffs of other dispatches.
 * Once closed, new delays fail with {@link RejectedExecutionException}.
 */
public final class ScheduledBackoffScheduler implements BackoffScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScheduledBackoffScheduler.class);

    private final ScheduledExecutorService timer;
    private final ExecutorService continuations;

    public ScheduledBackoffScheduler() {
        AtomicInteger timerCount = new AtomicInteger();
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retry-backoff-" + timerCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        AtomicInteger continuationCount = new AtomicInteger();
        this.continuations = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "retry-continuation-" + continuationCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<Void> delay(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        try {
            timer.schedule(() -> resume(future), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
        return future;
    }

    private void resume(CompletableFuture<Void> future) {
        try {
            continuations.execute(() -> future.complete(null));
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
    }

    @Override
    public void close() {
        // Pending delays still fire after shutdown; the continuation pool goes last
        shutdown(timer);
        shutdown(continuations);
        log.debug("Backoff scheduler stopped");
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
