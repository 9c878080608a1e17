package net.bulwark.Kafka.Deduplication;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, time-windowed memory of the event ids this process has already seen.
 *
 * Entries expire {@code ttl} after insertion. Expired entries are swept lazily on every
 * {@link #isDuplicate(String)} call, there is no background timer. When the cache grows past
 * {@code maxSize} the oldest inserted entry is evicted (insertion order, not access order).
 *
 * This is a best-effort guard: an id that aged out or was evicted under pressure is no longer
 * recognised. One instance is shared by all partitions of the process; every operation runs under
 * a single lock because {@code isDuplicate} both reads and writes.
 */
public class EventDeduplicator {

    private static final Logger logger = LoggerFactory.getLogger(EventDeduplicator.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final int DEFAULT_MAX_SIZE = 10_000;

    private final Duration ttl;
    private final int maxSize;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // insertion ordered: the first key is always the oldest entry
    private final LinkedHashMap<String, Instant> entries = new LinkedHashMap<>();

    // Metrics
    private final AtomicLong duplicateCount = new AtomicLong(0);
    private final AtomicLong totalChecks = new AtomicLong(0);
    private final AtomicLong evictionCount = new AtomicLong(0);

    public EventDeduplicator() {
        this(DEFAULT_TTL, DEFAULT_MAX_SIZE, Clock.systemUTC());
    }

    public EventDeduplicator(Duration ttl, int maxSize, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "clock");

        logger.info("Initializing EventDeduplicator with TTL: {}, max capacity: {} entries", ttl, maxSize);
    }

    /**
     * Checks whether an event id was already seen and records it if not.
     *
     * @param eventId the event id, may be null or empty
     * @return true if the id is live in the cache (duplicate), false on first sight or when the id
     *         is null/empty (such ids are never deduplicated and never stored)
     */
    public boolean isDuplicate(String eventId) {
        if (eventId == null || eventId.isEmpty()) {
            logger.debug("Cannot deduplicate - eventId is null or empty");
            return false;
        }

        totalChecks.incrementAndGet();
        lock.lock();
        try {
            Instant now = clock.instant();
            sweepExpired(now);

            if (entries.containsKey(eventId)) {
                duplicateCount.incrementAndGet();
                logger.debug("Duplicate detected for event ID: {}", eventId);
                return true;
            }

            entries.put(eventId, now);
            if (entries.size() > maxSize) {
                evictOldest();
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes an event id so that its next delivery is processed again.
     *
     * @return true if an entry was removed
     */
    public boolean forget(String eventId) {
        if (eventId == null || eventId.isEmpty()) {
            return false;
        }
        lock.lock();
        try {
            boolean removed = entries.remove(eventId) != null;
            if (removed) {
                logger.debug("Released event ID: {}", eventId);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of stored entries, including expired ones not yet swept.
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every entry (for tests or manual intervention). Counters are kept.
     */
    public void clear() {
        lock.lock();
        try {
            logger.warn("Clearing {} deduplication entries", entries.size());
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    private void sweepExpired(Instant now) {
        Iterator<Map.Entry<String, Instant>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Instant> entry = iterator.next();
            if (Duration.between(entry.getValue(), now).compareTo(ttl) > 0) {
                iterator.remove();
            }
        }
    }

    private void evictOldest() {
        Iterator<String> iterator = entries.keySet().iterator();
        String oldest = iterator.next();
        iterator.remove();
        evictionCount.incrementAndGet();
        logger.debug("Capacity {} reached, evicted oldest event ID: {}", maxSize, oldest);
    }

    public Duration getTtl() {
        return ttl;
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Get the number of duplicate events detected.
     */
    public long getDuplicateCount() {
        return duplicateCount.get();
    }

    /**
     * Get the total number of deduplication checks performed on non-empty ids.
     */
    public long getTotalChecks() {
        return totalChecks.get();
    }

    /**
     * Get the current hit rate (duplicates / total checks).
     */
    public double getHitRate() {
        long total = totalChecks.get();
        return total > 0 ? (double) duplicateCount.get() / total : 0.0;
    }

    /**
     * Get deduplication statistics.
     */
    public DeduplicationStats getStats() {
        return new DeduplicationStats(
                duplicateCount.get(),
                totalChecks.get(),
                evictionCount.get(),
                size(),
                maxSize,
                getHitRate()
        );
    }

    /**
     * Container for deduplication statistics.
     */
    public static class DeduplicationStats {
        private final long duplicateCount;
        private final long totalChecks;
        private final long evictionCount;
        private final long currentCacheSize;
        private final long maxCapacity;
        private final double hitRate;

        public DeduplicationStats(long duplicateCount, long totalChecks, long evictionCount,
                                  long currentCacheSize, long maxCapacity, double hitRate) {
            this.duplicateCount = duplicateCount;
            this.totalChecks = totalChecks;
            this.evictionCount = evictionCount;
            this.currentCacheSize = currentCacheSize;
            this.maxCapacity = maxCapacity;
            this.hitRate = hitRate;
        }

        public long getDuplicateCount() {
            return duplicateCount;
        }

        public long getTotalChecks() {
            return totalChecks;
        }

        public long getEvictionCount() {
            return evictionCount;
        }

        public long getCurrentCacheSize() {
            return currentCacheSize;
        }

        public long getMaxCapacity() {
            return maxCapacity;
        }

        public double getHitRate() {
            return hitRate;
        }

        public double getCacheUtilization() {
            return maxCapacity > 0 ? (double) currentCacheSize / maxCapacity : 0.0;
        }

        @Override
        public String toString() {
            return String.format("DeduplicationStats{duplicates=%d, totalChecks=%d, evictions=%d, cacheSize=%d/%d (%.2f%%), hitRate=%.4f}",
                    duplicateCount, totalChecks, evictionCount, currentCacheSize, maxCapacity,
                    getCacheUtilization() * 100, hitRate);
        }
    }
}
