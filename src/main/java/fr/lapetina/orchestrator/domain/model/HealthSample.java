package fr.lapetina.orchestrator.domain.model;

import java.time.Instant;

/**
 * One observation of a provider, either from the probe loop or from a dispatch attempt.
 *
 * @param latencyMs  round-trip time of the probe or attempt
 * @param success    whether the provider answered correctly
 * @param modelCount number of models advertised, 0 when unknown
 * @param error      failure description, null on success
 * @param observedAt when the sample was taken
 */
public record HealthSample(
        long latencyMs,
        boolean success,
        int modelCount,
        String error,
        Instant observedAt
) {
    public HealthSample {
        if (latencyMs < 0) {
            throw new IllegalArgumentException("Latency must not be negative: " + latencyMs);
        }
        if (observedAt == null) {
            observedAt = Instant.now();
        }
    }

    public static HealthSample success(long latencyMs, int modelCount) {
        return new HealthSample(latencyMs, true, modelCount, null, Instant.now());
    }

    public static HealthSample failure(long latencyMs, String error) {
        return new HealthSample(latencyMs, false, 0, error, Instant.now());
    }
}
