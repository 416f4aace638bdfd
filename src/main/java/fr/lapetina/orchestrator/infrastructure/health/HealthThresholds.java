package fr.lapetina.orchestrator.infrastructure.health;

/**
 * Tunables of the health classification.
 *
 * @param windowSize              samples kept per provider
 * @param outageConsecutiveFailures trailing failed samples that mean an outage
 * @param degradedSuccessRate     success rate below which a provider is degraded
 * @param degradedLatencyMs       average latency above which a provider is degraded
 */
public record HealthThresholds(
        int windowSize,
        int outageConsecutiveFailures,
        double degradedSuccessRate,
        long degradedLatencyMs
) {
    public HealthThresholds {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be at least 1: " + windowSize);
        }
        if (outageConsecutiveFailures < 1) {
            throw new IllegalArgumentException("outageConsecutiveFailures must be at least 1: " + outageConsecutiveFailures);
        }
        if (degradedSuccessRate < 0.0 || degradedSuccessRate > 1.0) {
            throw new IllegalArgumentException("degradedSuccessRate must be within [0, 1]: " + degradedSuccessRate);
        }
    }

    public static HealthThresholds defaults() {
        return new HealthThresholds(20, 3, 0.8, 5000);
    }
}
