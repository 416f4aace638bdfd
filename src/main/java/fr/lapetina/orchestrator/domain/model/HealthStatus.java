package fr.lapetina.orchestrator.domain.model;

/**
 * Coarse health classification of a provider.
 *
 * OPERATIONAL: success rate and latency within thresholds
 * DEGRADED: responding, but failing too often or answering too slowly
 * OUTAGE: nothing succeeded in the window, or the latest probes all failed
 * UNKNOWN: no sample recorded yet
 */
public enum HealthStatus {
    OPERATIONAL,
    DEGRADED,
    OUTAGE,
    UNKNOWN;

    /**
     * Numeric value exported by the status gauge.
     */
    public int gaugeValue() {
        return switch (this) {
            case OPERATIONAL -> 3;
            case DEGRADED -> 2;
            case OUTAGE -> 1;
            case UNKNOWN -> 0;
        };
    }
}
