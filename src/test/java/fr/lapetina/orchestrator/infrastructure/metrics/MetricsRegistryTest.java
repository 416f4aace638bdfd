package fr.lapetina.orchestrator.infrastructure.metrics;

import fr.lapetina.orchestrator.domain.model.AttemptRecord;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private final MetricsRegistry metrics = new MetricsRegistry("test", false);

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    private static AttemptRecord attempt(String provider, boolean success, int calls, ErrorType errorType) {
        return new AttemptRecord(provider, "summarize", "d1", success, 40, calls, errorType,
                success ? null : "boom", Instant.now());
    }

    @Test
    @DisplayName("should count attempts, calls and errors per provider")
    void shouldRecordAttempts() {
        metrics.record(attempt("openai", false, 3, ErrorType.TRANSIENT));
        metrics.record(attempt("anthropic", true, 1, null));
        metrics.record(attempt("openai", true, 2, null));

        MeterRegistry registry = metrics.getRegistry();
        assertThat(registry.get("test_provider_calls_total").tag("provider", "openai").counter().count())
                .isEqualTo(5.0);
        assertThat(registry.get("test_provider_attempts_total")
                .tag("provider", "openai").tag("outcome", "failure").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("test_provider_errors_total")
                .tag("provider", "openai").tag("type", "TRANSIENT").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("test_provider_attempt_latency").tag("provider", "anthropic").timer().count())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("should record dispatch outcomes and preference fallbacks")
    void shouldRecordDispatches() {
        metrics.recordDispatch("summarize", "success", Duration.ofMillis(120));
        metrics.recordDispatch("summarize", "exhausted", Duration.ofMillis(900));
        metrics.incrementPreferenceFallback("lookup_failed");

        MeterRegistry registry = metrics.getRegistry();
        assertThat(registry.get("test_dispatch_total").tag("outcome", "exhausted").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("test_dispatch_latency").tag("operation", "summarize").timer().count())
                .isEqualTo(2);
        assertThat(registry.get("test_preference_fallback_total").tag("reason", "lookup_failed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should expose gauges in the Prometheus scrape")
    void shouldScrapeGauges() {
        AtomicInteger size = new AtomicInteger(7);
        metrics.registerGauge("context_cache_size", "Cache entries", size::get);
        metrics.registerProviderHealth("openai", () -> 3);

        String scrape = metrics.scrape();

        assertThat(scrape).contains("test_context_cache_size 7.0");
        assertThat(scrape).contains("test_provider_health{provider=\"openai\"");
        assertThat(metrics.getRegistry().get("test_provider_health").tag("provider", "openai").gauge().value())
                .isEqualTo(3.0);
    }
}
