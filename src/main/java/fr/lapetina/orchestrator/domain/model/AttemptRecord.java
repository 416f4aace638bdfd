package fr.lapetina.orchestrator.domain.model;

import java.time.Instant;

/**
 * Final outcome of one provider within one dispatch, after local retries.
 * Emitted once per attempted provider to the health monitor and analytics sinks.
 *
 * @param providerId   provider that was attempted
 * @param operation    logical operation name, e.g. {@code generateOutline}
 * @param dispatchId   identifier of the dispatch the attempt belongs to
 * @param success      whether the provider eventually succeeded
 * @param latencyMs    wall time spent on this provider, retries included
 * @param calls        number of underlying calls made against the provider
 * @param errorType    classification of the failure, null on success
 * @param errorMessage failure message, null on success
 * @param timestamp    when the attempt settled
 */
public record AttemptRecord(
        String providerId,
        String operation,
        String dispatchId,
        boolean success,
        long latencyMs,
        int calls,
        ErrorType errorType,
        String errorMessage,
        Instant timestamp
) {
    /**
     * Health sample measured with the given call latency rather than the attempt wall time.
     */
    public HealthSample toHealthSample(long callLatencyMs) {
        return new HealthSample(callLatencyMs, success, 0, errorMessage, timestamp);
    }
}
