package fr.lapetina.orchestrator.domain.model;

import java.time.Instant;

/**
 * Read model of a provider's health, rebuilt by the health monitor on every sample.
 * Instances are never mutated; readers always see a consistent snapshot.
 *
 * @param providerId    provider this record describes
 * @param name          display name of the provider
 * @param enabled       whether the provider is enabled in configuration
 * @param status        classification derived from the rolling window
 * @param avgLatencyMs  average latency over the rolling window
 * @param successRate   success ratio over the rolling window, 0.0 to 1.0
 * @param modelCount    models reported by the last successful probe
 * @param sampleCount   samples currently held in the window
 * @param lastProbeAt   time of the most recent sample, null when none
 */
public record ProviderHealthRecord(
        String providerId,
        String name,
        boolean enabled,
        HealthStatus status,
        long avgLatencyMs,
        double successRate,
        int modelCount,
        int sampleCount,
        Instant lastProbeAt
) {
    /**
     * Initial record of a provider that has not been sampled yet.
     */
    public static ProviderHealthRecord unknown(Provider provider) {
        return new ProviderHealthRecord(
                provider.getId(),
                provider.getName(),
                provider.isEnabled(),
                HealthStatus.UNKNOWN,
                0,
                0.0,
                0,
                0,
                null
        );
    }
}
