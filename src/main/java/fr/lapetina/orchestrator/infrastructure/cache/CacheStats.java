package fr.lapetina.orchestrator.infrastructure.cache;

import java.util.List;

/**
 * Snapshot of cache accounting since creation or the last clear.
 *
 * @param hits    lookups that returned a payload
 * @param misses  lookups that found nothing, an expired entry or a stale hash
 * @param hitRate hits / (hits + misses), 0 when there were no lookups
 * @param size    entries currently held
 * @param maxSize capacity
 * @param entries per-entry view, oldest first
 */
public record CacheStats(
        long hits,
        long misses,
        double hitRate,
        int size,
        int maxSize,
        List<EntryInfo> entries
) {
    public CacheStats {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public long requests() {
        return hits + misses;
    }

    /**
     * @param subjectId subject the entry belongs to
     * @param hash      content hash stored with the entry
     * @param ageMs     time since the entry was cached
     */
    public record EntryInfo(String subjectId, String hash, long ageMs) {
    }

    static double hitRate(long hits, long misses) {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
