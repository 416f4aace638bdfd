package fr.lapetina.orchestrator.dispatch;

import fr.lapetina.orchestrator.domain.model.AttemptRecord;

/**
 * Receives one record per provider attempted by a dispatch.
 *
 * Called asynchronously after the attempt settled; implementations may be slow
 * or throw without affecting the dispatch result.
 */
@FunctionalInterface
public interface AnalyticsSink {

    void record(AttemptRecord attempt);
}
