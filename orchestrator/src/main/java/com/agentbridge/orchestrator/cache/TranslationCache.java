package com.agentbridge.orchestrator.cache;

import com.agentbridge.orchestrator.error.CacheException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Translation response cache keyed by (agentId, sourceFormat, targetFormat).
 *
 * <p>Entries are sharded by agent id, so everything cached for one agent
 * lives in a single shard and {@link #invalidate} locks only that shard.
 * When a shard is full the entry with the fewest hits is evicted (ties go to
 * the oldest). Expired entries are purged by {@link #sweepExpired()}, which
 * the cache's own scheduler runs between {@link #start()} and
 * {@link #close()}; tests call it directly with a fixed {@link Clock}.
 *
 * <p>Expired entries are also ignored on read, so a late sweep never serves
 * stale data.
 */
public class TranslationCache<V> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TranslationCache.class);

    private static final class Entry<V> {
        final V       value;
        final Instant timestamp;
        final Duration ttl;
        long          hitCount;

        Entry(V value, Instant timestamp, Duration ttl) {
            this.value     = value;
            this.timestamp = timestamp;
            this.ttl       = ttl;
        }

        boolean expiredAt(Instant now) {
            return !now.isBefore(timestamp.plus(ttl));
        }
    }

    private static final class Shard<V> {
        final ReentrantLock              lock    = new ReentrantLock();
        final Map<CacheKey, Entry<V>>    entries = new LinkedHashMap<>();
    }

    private final Shard<V>[] shards;
    private final int        capacityPerShard;
    private final Duration   ttl;
    private final Duration   sweepInterval;
    private final Clock      clock;

    private final Counter    hits;
    private final Counter    misses;
    private final AtomicLong hitCount    = new AtomicLong();
    private final AtomicLong missCount   = new AtomicLong();
    private final AtomicLong evictions   = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    private ScheduledExecutorService sweeper;
    private ScheduledFuture<?>       sweepTask;

    @SuppressWarnings("unchecked")
    public TranslationCache(int capacity, int shardCount, Duration ttl, Duration sweepInterval,
                            Clock clock, MeterRegistry meterRegistry) {
        if (capacity < 1 || shardCount < 1) {
            throw new IllegalArgumentException("capacity and shardCount must be positive");
        }
        this.shards           = new Shard[shardCount];
        for (int i = 0; i < shardCount; i++) shards[i] = new Shard<>();
        this.capacityPerShard = Math.max(1, (capacity + shardCount - 1) / shardCount);
        this.ttl              = ttl;
        this.sweepInterval    = sweepInterval;
        this.clock            = clock;
        this.hits             = meterRegistry.counter("agentbridge.cache.hits");
        this.misses           = meterRegistry.counter("agentbridge.cache.misses");
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /** Start the periodic TTL sweep. Idempotent. */
    public synchronized void start() {
        if (sweeper != null) return;
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "translation-cache-sweeper");
            t.setDaemon(true);
            return t;
        });
        long periodMs = sweepInterval.toMillis();
        sweepTask = sweeper.scheduleAtFixedRate(this::sweepQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("Cache sweep scheduled every {} ms ({} shards, {} entries per shard, ttl {})",
                periodMs, shards.length, capacityPerShard, ttl);
    }

    /** Stop the sweep task; cached entries stay readable. */
    @Override
    public synchronized void close() {
        if (sweeper == null) return;
        sweepTask.cancel(false);
        sweeper.shutdownNow();
        sweeper = null;
        sweepTask = null;
    }

    public synchronized boolean isRunning() {
        return sweeper != null;
    }

    private void sweepQuietly() {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            // An exception would cancel the scheduled task for good.
            log.warn("Cache sweep failed: {}", e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Operations
    // ------------------------------------------------------------------

    /** @throws CacheException on an internal failure; callers treat it as a miss */
    public Optional<V> get(CacheKey key) {
        Shard<V> shard = shardFor(key.agentId());
        shard.lock.lock();
        try {
            Entry<V> entry = shard.entries.get(key);
            if (entry == null || entry.expiredAt(clock.instant())) {
                missCount.incrementAndGet();
                misses.increment();
                return Optional.empty();
            }
            entry.hitCount++;
            hitCount.incrementAndGet();
            hits.increment();
            return Optional.of(entry.value);
        } catch (RuntimeException e) {
            throw new CacheException("Cache read failed for " + key, e);
        } finally {
            shard.lock.unlock();
        }
    }

    /** @throws CacheException on an internal failure; callers carry on uncached */
    public void put(CacheKey key, V value) {
        Shard<V> shard = shardFor(key.agentId());
        shard.lock.lock();
        try {
            if (!shard.entries.containsKey(key) && shard.entries.size() >= capacityPerShard) {
                evictLeastHit(shard);
            }
            shard.entries.put(key, new Entry<>(value, clock.instant(), ttl));
        } catch (RuntimeException e) {
            throw new CacheException("Cache write failed for " + key, e);
        } finally {
            shard.lock.unlock();
        }
    }

    /** Drop every entry cached for {@code agentId}. Must follow any store mutation of that agent. */
    public int invalidate(String agentId) {
        Shard<V> shard = shardFor(agentId);
        shard.lock.lock();
        try {
            int before = shard.entries.size();
            shard.entries.keySet().removeIf(k -> k.agentId().equals(agentId));
            int removed = before - shard.entries.size();
            if (removed > 0) log.debug("Invalidated {} cache entries for agent {}", removed, agentId);
            return removed;
        } finally {
            shard.lock.unlock();
        }
    }

    /** Purge TTL-expired entries, one shard at a time. */
    public int sweepExpired() {
        Instant now = clock.instant();
        int purged = 0;
        for (Shard<V> shard : shards) {
            shard.lock.lock();
            try {
                int before = shard.entries.size();
                shard.entries.values().removeIf(e -> e.expiredAt(now));
                purged += before - shard.entries.size();
            } finally {
                shard.lock.unlock();
            }
        }
        if (purged > 0) {
            expirations.addAndGet(purged);
            log.debug("Swept {} expired cache entries", purged);
        }
        return purged;
    }

    public void clear() {
        for (Shard<V> shard : shards) {
            shard.lock.lock();
            try {
                shard.entries.clear();
            } finally {
                shard.lock.unlock();
            }
        }
    }

    public CacheStats stats() {
        int size = 0;
        for (Shard<V> shard : shards) {
            shard.lock.lock();
            try {
                size += shard.entries.size();
            } finally {
                shard.lock.unlock();
            }
        }
        return new CacheStats(size, capacityPerShard * shards.length,
                hitCount.get(), missCount.get(), evictions.get(), expirations.get());
    }

    private Shard<V> shardFor(String agentId) {
        return shards[Math.floorMod(agentId.hashCode(), shards.length)];
    }

    // LinkedHashMap iterates oldest first, so min() breaks hit-count ties by age.
    private void evictLeastHit(Shard<V> shard) {
        shard.entries.entrySet().stream()
                .min(Comparator.comparingLong(e -> e.getValue().hitCount))
                .map(Map.Entry::getKey)
                .ifPresent(victim -> {
                    shard.entries.remove(victim);
                    evictions.incrementAndGet();
                });
    }
}
