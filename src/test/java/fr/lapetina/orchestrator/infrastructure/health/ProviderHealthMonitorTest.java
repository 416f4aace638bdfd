package fr.lapetina.orchestrator.infrastructure.health;

import fr.lapetina.orchestrator.domain.model.HealthSample;
import fr.lapetina.orchestrator.domain.model.HealthStatus;
import fr.lapetina.orchestrator.domain.model.Provider;
import fr.lapetina.orchestrator.domain.model.ProviderHealthRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderHealthMonitorTest {

    private Provider openai;
    private Provider anthropic;
    private ProviderRegistry registry;
    private StubProviderProbe probe;
    private ProviderHealthMonitor monitor;

    @BeforeEach
    void setUp() {
        openai = Provider.builder().id("openai").priority(1).build();
        anthropic = Provider.builder().id("anthropic").priority(2).build();
        registry = new ProviderRegistry(List.of(openai, anthropic));
        probe = new StubProviderProbe();
        monitor = new ProviderHealthMonitor(
                registry,
                probe,
                new HealthThresholds(10, 3, 0.8, 5000),
                Duration.ofMillis(50),
                Duration.ofMillis(100)
        );
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    @Nested
    @DisplayName("classification")
    class Classification {

        @Test
        @DisplayName("should be UNKNOWN without samples")
        void shouldBeUnknownWithoutSamples() {
            ProviderHealthRecord record = monitor.getStatus(openai);

            assertThat(record.status()).isEqualTo(HealthStatus.UNKNOWN);
            assertThat(record.sampleCount()).isZero();
            assertThat(record.lastProbeAt()).isNull();
        }

        @Test
        @DisplayName("should be OPERATIONAL with fast successful samples")
        void shouldBeOperational() {
            monitor.recordSample(openai, HealthSample.success(120, 12));
            monitor.recordSample(openai, HealthSample.success(80, 12));

            ProviderHealthRecord record = monitor.getStatus(openai);
            assertThat(record.status()).isEqualTo(HealthStatus.OPERATIONAL);
            assertThat(record.avgLatencyMs()).isEqualTo(100);
            assertThat(record.successRate()).isEqualTo(1.0);
            assertThat(record.modelCount()).isEqualTo(12);
            assertThat(record.lastProbeAt()).isNotNull();
        }

        @Test
        @DisplayName("should be OUTAGE with 0% success in the window")
        void shouldBeOutageWithNoSuccess() {
            monitor.recordSample(openai, HealthSample.failure(10, "HTTP 503"));

            assertThat(monitor.getStatus(openai).status()).isEqualTo(HealthStatus.OUTAGE);
            assertThat(monitor.getStatus(openai).successRate()).isZero();
        }

        @Test
        @DisplayName("should be OUTAGE when the latest samples all failed")
        void shouldBeOutageAfterConsecutiveFailures() {
            for (int i = 0; i < 7; i++) {
                monitor.recordSample(openai, HealthSample.success(100, 1));
            }
            monitor.recordSample(openai, HealthSample.failure(10, "down"));
            monitor.recordSample(openai, HealthSample.failure(10, "down"));
            assertThat(monitor.getStatus(openai).status()).isEqualTo(HealthStatus.DEGRADED);

            monitor.recordSample(openai, HealthSample.failure(10, "down"));

            assertThat(monitor.getStatus(openai).status()).isEqualTo(HealthStatus.OUTAGE);
        }

        @Test
        @DisplayName("should be DEGRADED below the success threshold")
        void shouldBeDegradedOnLowSuccessRate() {
            monitor.recordSample(openai, HealthSample.success(100, 1));
            monitor.recordSample(openai, HealthSample.failure(10, "HTTP 500"));
            monitor.recordSample(openai, HealthSample.success(100, 1));

            assertThat(monitor.getStatus(openai).status()).isEqualTo(HealthStatus.DEGRADED);
        }

        @Test
        @DisplayName("should be DEGRADED when latency is above the threshold")
        void shouldBeDegradedOnHighLatency() {
            monitor.recordSample(openai, HealthSample.success(6000, 1));

            assertThat(monitor.getStatus(openai).status()).isEqualTo(HealthStatus.DEGRADED);
        }

        @Test
        @DisplayName("should recover to OPERATIONAL once failures leave the window")
        void shouldRecover() {
            for (int i = 0; i < 10; i++) {
                monitor.recordSample(openai, HealthSample.failure(10, "down"));
            }
            assertThat(monitor.getStatus(openai).status()).isEqualTo(HealthStatus.OUTAGE);

            for (int i = 0; i < 10; i++) {
                monitor.recordSample(openai, HealthSample.success(100, 1));
            }

            ProviderHealthRecord record = monitor.getStatus(openai);
            assertThat(record.status()).isEqualTo(HealthStatus.OPERATIONAL);
            assertThat(record.sampleCount()).isEqualTo(10);
            assertThat(record.successRate()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should keep the last known model count on samples without models")
        void shouldKeepModelCount() {
            monitor.recordSample(openai, HealthSample.success(100, 42));
            monitor.recordSample(openai, HealthSample.success(100, 0));

            assertThat(monitor.getStatus(openai).modelCount()).isEqualTo(42);
        }
    }

    @Nested
    @DisplayName("probing")
    class Probing {

        @Test
        @DisplayName("should turn probe errors into failed samples")
        void shouldTurnErrorsIntoFailedSamples() {
            probe.failing("openai", new IllegalStateException("connection refused"));

            HealthSample sample = monitor.probe(openai).join();

            assertThat(sample.success()).isFalse();
            assertThat(sample.error()).isEqualTo("connection refused");
        }

        @Test
        @DisplayName("should time out hanging probes")
        void shouldTimeOutHangingProbes() {
            probe.hanging("openai");

            HealthSample sample = monitor.probe(openai).orTimeout(5, TimeUnit.SECONDS).join();

            assertThat(sample.success()).isFalse();
            assertThat(sample.error()).contains("timed out");
        }

        @Test
        @DisplayName("checkAllProviders should probe and record every enabled provider")
        void shouldCheckAllProviders() {
            probe.healthy("openai", 100, 5);
            probe.failing("anthropic", new RuntimeException("HTTP 503"));

            monitor.checkAllProviders().orTimeout(5, TimeUnit.SECONDS).join();

            assertThat(monitor.getStatus("openai").status()).isEqualTo(HealthStatus.OPERATIONAL);
            assertThat(monitor.getStatus("anthropic").status()).isEqualTo(HealthStatus.OUTAGE);
        }

        @Test
        @DisplayName("should skip disabled providers")
        void shouldSkipDisabledProviders() {
            registry.registerProvider(Provider.builder().id("mistral").enabled(false).build());

            monitor.checkAllProviders().join();

            assertThat(probe.getProbeCount()).isEqualTo(2);
            assertThat(monitor.getStatus("mistral").status()).isEqualTo(HealthStatus.UNKNOWN);
        }

        @Test
        @DisplayName("background loop should sample providers without being asked")
        void backgroundLoopShouldSample() throws InterruptedException {
            monitor.start();

            long deadline = System.currentTimeMillis() + 5000;
            while (monitor.getStatus(openai).sampleCount() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }

            assertThat(monitor.isRunning()).isTrue();
            assertThat(monitor.getStatus(openai).sampleCount()).isGreaterThanOrEqualTo(2);
        }
    }

    @Test
    @DisplayName("getAllStatuses should list every provider in priority order")
    void shouldListAllStatuses() {
        monitor.recordSample(anthropic, HealthSample.success(100, 1));

        assertThat(monitor.getAllStatuses())
                .extracting(ProviderHealthRecord::providerId, ProviderHealthRecord::status)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple("openai", HealthStatus.UNKNOWN),
                        org.assertj.core.groups.Tuple.tuple("anthropic", HealthStatus.OPERATIONAL)
                );
    }
}
