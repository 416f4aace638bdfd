package fr.lapetina.orchestrator.infrastructure.retry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Backoff scheduler that completes immediately and remembers the requested delays.
 */
public class RecordingBackoffScheduler implements BackoffScheduler {

    private final List<Duration> delays = new CopyOnWriteArrayList<>();

    @Override
    public CompletableFuture<Void> delay(Duration delay) {
        delays.add(delay);
        return CompletableFuture.completedFuture(null);
    }

    public List<Duration> getDelays() {
        return List.copyOf(delays);
    }
}
