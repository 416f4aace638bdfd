package fr.lapetina.orchestrator.dispatch;

import fr.lapetina.orchestrator.domain.model.AttemptRecord;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sink that keeps every record it receives.
 */
public class RecordingAnalyticsSink implements AnalyticsSink {

    private final List<AttemptRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void record(AttemptRecord attempt) {
        records.add(attempt);
    }

    public List<AttemptRecord> getRecords() {
        return List.copyOf(records);
    }
}
