package fr.lapetina.orchestrator.dispatch;

import fr.lapetina.orchestrator.domain.model.AttemptRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes attempt records to a dedicated {@code analytics} logger, one line per attempt.
 */
public final class LoggingAnalyticsSink implements AnalyticsSink {

    private static final Logger log = LoggerFactory.getLogger("analytics");

    @Override
    public void record(AttemptRecord attempt) {
        if (attempt.success()) {
            log.info("provider={}, operation={}, dispatchId={}, success=true, latencyMs={}, calls={}",
                    attempt.providerId(), attempt.operation(), attempt.dispatchId(),
                    attempt.latencyMs(), attempt.calls());
        } else {
            log.info("provider={}, operation={}, dispatchId={}, success=false, latencyMs={}, calls={}, errorType={}, error={}",
                    attempt.providerId(), attempt.operation(), attempt.dispatchId(),
                    attempt.latencyMs(), attempt.calls(), attempt.errorType(), attempt.errorMessage());
        }
    }
}
