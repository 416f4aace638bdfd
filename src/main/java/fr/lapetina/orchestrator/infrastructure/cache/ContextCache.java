package fr.lapetina.orchestrator.infrastructure.cache;

import fr.lapetina.orchestrator.domain.model.OperationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Bounded, TTL-based cache of assembled operation contexts, one entry per subject.
 *
 * An entry is served only while it is younger than the TTL and the caller's
 * content hash equals the stored one. Expired and stale entries are evicted
 * lazily by {@link #get} and counted as misses; {@link #cleanup()} sweeps the
 * rest. When a new subject arrives at capacity, exactly one entry, the oldest
 * by insertion, is evicted.
 *
 * All state is guarded by a single lock; the extractor of
 * {@link #getOrCompute} runs outside of it.
 *
 * @param <V> payload type
 */
public final class ContextCache<V> {

    private static final Logger log = LoggerFactory.getLogger(ContextCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_SIZE = 50;

    private final Duration ttl;
    private final int maxSize;
    private final Clock clock;
    private final ContextHasher hasher;

    private final ReentrantLock lock = new ReentrantLock();
    // Insertion ordered; re-caching removes then puts to move the subject last
    private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>();
    private long hits;
    private long misses;

    public ContextCache(Duration ttl, int maxSize, Clock clock, ContextHasher hasher) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1: " + maxSize);
        }
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.hasher = Objects.requireNonNull(hasher, "Hasher is required");
    }

    public ContextCache(Duration ttl, int maxSize) {
        this(ttl, maxSize, Clock.systemUTC(), new ContextHasher());
    }

    public ContextCache() {
        this(DEFAULT_TTL, DEFAULT_MAX_SIZE);
    }

    /**
     * Stores the payload for a subject, replacing any previous entry.
     */
    public void set(String subjectId, V payload, String contentHash) {
        Objects.requireNonNull(subjectId, "Subject ID is required");
        Objects.requireNonNull(payload, "Payload is required");
        Objects.requireNonNull(contentHash, "Content hash is required");

        CacheEntry<V> entry = new CacheEntry<>(subjectId, payload, contentHash, clock.instant());
        String evicted = null;

        lock.lock();
        try {
            CacheEntry<V> previous = entries.remove(subjectId);
            if (previous == null && entries.size() >= maxSize) {
                Iterator<String> oldest = entries.keySet().iterator();
                evicted = oldest.next();
                oldest.remove();
            }
            entries.put(subjectId, entry);
        } finally {
            lock.unlock();
        }

        if (evicted != null) {
            log.debug("Context cache full, evicted oldest entry: subjectId={}, maxSize={}", evicted, maxSize);
        }
        log.debug("Context cached: subjectId={}, hash={}", subjectId, shortHash(contentHash));
    }

    /**
     * Returns the payload if a fresh entry with the same hash exists.
     * Expired or stale entries are removed and counted as misses.
     */
    public Optional<V> get(String subjectId, String contentHash) {
        Objects.requireNonNull(subjectId, "Subject ID is required");
        String reason = null;
        V payload = null;

        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(subjectId);
            if (entry == null) {
                misses++;
                reason = "absent";
            } else if (isExpired(entry, clock.instant())) {
                entries.remove(subjectId);
                misses++;
                reason = "expired";
            } else if (!entry.contentHash().equals(contentHash)) {
                entries.remove(subjectId);
                misses++;
                reason = "stale";
            } else {
                hits++;
                payload = entry.payload();
            }
        } finally {
            lock.unlock();
        }

        if (payload != null) {
            log.debug("Context cache hit: subjectId={}", subjectId);
            return Optional.of(payload);
        }
        log.debug("Context cache miss: subjectId={}, reason={}", subjectId, reason);
        return Optional.empty();
    }

    /**
     * Returns the cached payload for the context or computes, caches and returns it.
     * The extractor is called without holding the cache lock, so two concurrent
     * callers may both compute; the last one to finish wins.
     */
    public V getOrCompute(OperationContext context, Function<OperationContext, V> extractor) {
        String hash = hasher.hash(context);
        Optional<V> cached = get(context.subjectId(), hash);
        if (cached.isPresent()) {
            return cached.get();
        }
        V computed = extractor.apply(context);
        if (computed != null) {
            set(context.subjectId(), computed, hash);
        }
        return computed;
    }

    /**
     * Removes the entry of a subject regardless of its age or hash.
     *
     * @return true if an entry was removed
     */
    public boolean invalidate(String subjectId) {
        boolean removed;
        lock.lock();
        try {
            removed = entries.remove(subjectId) != null;
        } finally {
            lock.unlock();
        }
        if (removed) {
            log.debug("Context invalidated: subjectId={}", subjectId);
        }
        return removed;
    }

    /**
     * Drops every entry and resets hit and miss counters.
     */
    public void clear() {
        int dropped;
        lock.lock();
        try {
            dropped = entries.size();
            entries.clear();
            hits = 0;
            misses = 0;
        } finally {
            lock.unlock();
        }
        log.info("Context cache cleared: droppedEntries={}", dropped);
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        int removed = 0;
        Instant now = clock.instant();
        lock.lock();
        try {
            Iterator<CacheEntry<V>> it = entries.values().iterator();
            while (it.hasNext()) {
                if (isExpired(it.next(), now)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.debug("Context cache cleanup: removedEntries={}", removed);
        }
        return removed;
    }

    public CacheStats stats() {
        Instant now = clock.instant();
        lock.lock();
        try {
            List<CacheStats.EntryInfo> infos = new ArrayList<>(entries.size());
            for (Map.Entry<String, CacheEntry<V>> e : entries.entrySet()) {
                long age = Duration.between(e.getValue().createdAt(), now).toMillis();
                infos.add(new CacheStats.EntryInfo(e.getKey(), e.getValue().contentHash(), age));
            }
            return new CacheStats(hits, misses, CacheStats.hitRate(hits, misses), entries.size(), maxSize, infos);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public ContextHasher getHasher() {
        return hasher;
    }

    public Duration getTtl() {
        return ttl;
    }

    public int getMaxSize() {
        return maxSize;
    }

    private boolean isExpired(CacheEntry<V> entry, Instant now) {
        return Duration.between(entry.createdAt(), now).compareTo(ttl) >= 0;
    }

    private static String shortHash(String hash) {
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }

    private record CacheEntry<V>(String subjectId, V payload, String contentHash, Instant createdAt) {
    }
}
