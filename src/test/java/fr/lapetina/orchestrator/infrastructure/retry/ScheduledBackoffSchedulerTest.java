package fr.lapetina.orchestrator.infrastructure.retry;

import fr.lapetina.orchestrator.domain.exception.ProviderException;
import fr.lapetina.orchestrator.domain.model.Result;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduledBackoffSchedulerTest {

    private static final RetryPolicy FAST_RETRY = new RetryPolicy(
            3, Duration.ofMillis(20), 2.0, Duration.ofMillis(100), null);

    private ScheduledBackoffScheduler scheduler;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        scheduler = new ScheduledBackoffScheduler();
        executor = new RetryExecutor(scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    @DisplayName("should complete after the requested delay")
    void shouldCompleteAfterDelay() throws Exception {
        long start = System.nanoTime();

        scheduler.delay(Duration.ofMillis(50)).get(2, TimeUnit.SECONDS);

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(45);
    }

    @Test
    @DisplayName("should complete zero delays immediately")
    void shouldCompleteZeroDelayImmediately() {
        assertThat(scheduler.delay(Duration.ZERO)).isCompleted();
    }

    @Test
    @DisplayName("should not run retried operations on the timer thread")
    void shouldResumeOffTimerThread() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AtomicReference<String> retryThread = new AtomicReference<>();

        Result<String> result = executor.executeWithRetry(() -> {
            if (calls.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(ProviderException.fromStatus("p", 503, "HTTP 503"));
            }
            retryThread.set(Thread.currentThread().getName());
            return CompletableFuture.completedFuture("ok");
        }, FAST_RETRY).get(2, TimeUnit.SECONDS);

        assertThat(result.isSuccess()).isTrue();
        assertThat(retryThread.get()).startsWith("retry-continuation-");
    }

    @Test
    @DisplayName("should let concurrent retries run at the same time")
    void shouldRunConcurrentRetriesInParallel() throws Exception {
        // Each retry blocks until both retries are running
        CountDownLatch bothRetrying = new CountDownLatch(2);

        CompletableFuture<Result<Boolean>> first = executor.executeWithRetry(
                blockingRetry(bothRetrying), FAST_RETRY);
        CompletableFuture<Result<Boolean>> second = executor.executeWithRetry(
                blockingRetry(bothRetrying), FAST_RETRY);

        assertThat(first.get(5, TimeUnit.SECONDS).value()).isTrue();
        assertThat(second.get(5, TimeUnit.SECONDS).value()).isTrue();
    }

    private static Supplier<CompletableFuture<Boolean>> blockingRetry(CountDownLatch bothRetrying) {
        AtomicInteger calls = new AtomicInteger();
        return () -> {
            if (calls.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(ProviderException.fromStatus("p", 503, "HTTP 503"));
            }
            bothRetrying.countDown();
            try {
                return CompletableFuture.completedFuture(bothRetrying.await(2, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    @Test
    @DisplayName("should reject delays once closed")
    void shouldRejectDelaysAfterClose() {
        scheduler.close();

        CompletableFuture<Void> delay = scheduler.delay(Duration.ofMillis(10));

        assertThat(delay).isCompletedExceptionally();
        assertThat(delay.handle((v, ex) -> ex).join()).isInstanceOf(RejectedExecutionException.class);
    }

    @Test
    @DisplayName("should still settle a retrying operation once closed")
    void shouldSettleRetryAfterClose() throws Exception {
        scheduler.close();
        AtomicInteger calls = new AtomicInteger();
        ProviderException unavailable = ProviderException.fromStatus("p", 503, "HTTP 503");

        Result<String> result = executor.<String>executeWithRetry(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(unavailable);
        }, FAST_RETRY).get(2, TimeUnit.SECONDS);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).isSameAs(unavailable);
        assertThat(calls).hasValue(1);
    }
}
