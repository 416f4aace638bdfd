package fr.lapetina.orchestrator.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Payload and assembled side context of a generation task for one subject
 * (typically a project). Treated as an opaque value for hashing.
 *
 * @param subjectId identifier the cache entry is scoped by
 * @param payload   caller supplied payload, e.g. the current chapter text
 * @param sections  named side context, e.g. character or world summaries
 * @param metadata  anything else that should invalidate the cache when changed
 */
public record OperationContext(
        String subjectId,
        String payload,
        Map<String, String> sections,
        Map<String, String> metadata
) {
    public OperationContext {
        Objects.requireNonNull(subjectId, "Subject ID is required");
        payload = payload != null ? payload : "";
        sections = sections != null ? Collections.unmodifiableMap(new LinkedHashMap<>(sections)) : Map.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static OperationContext of(String subjectId, String payload) {
        return new OperationContext(subjectId, payload, Map.of(), Map.of());
    }
}
