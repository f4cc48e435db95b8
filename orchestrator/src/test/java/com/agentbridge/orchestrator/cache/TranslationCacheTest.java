package com.agentbridge.orchestrator.cache;

import com.agentbridge.orchestrator.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for TranslationCache. Time is driven by a MutableClock so TTL
 * behaviour is checked without sleeping.
 */
class TranslationCacheTest {

    static final Duration TTL = Duration.ofMinutes(10);

    MutableClock            clock;
    SimpleMeterRegistry     meters;
    TranslationCache<String> cache;

    @BeforeEach
    void setUp() {
        clock  = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        meters = new SimpleMeterRegistry();
        // single shard so capacity is exact
        cache  = new TranslationCache<>(2, 1, TTL, Duration.ofSeconds(30), clock, meters);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    // ------------------------------------------------------------------
    // get / put
    // ------------------------------------------------------------------

    @Test
    void put_thenGet_hits() {
        cache.put(key("ada", "crewai"), "translated");

        assertThat(cache.get(key("ada", "crewai"))).contains("translated");
        assertThat(cache.get(key("ada", "lmos"))).isEmpty();

        CacheStats stats = cache.stats();
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.5);
        assertThat(meters.counter("agentbridge.cache.hits").count()).isEqualTo(1.0);
    }

    @Test
    void get_expiredEntry_isAMiss_evenBeforeSweep() {
        cache.put(key("ada", "crewai"), "translated");
        clock.advance(TTL);

        assertThat(cache.get(key("ada", "crewai"))).isEmpty();
    }

    // ------------------------------------------------------------------
    // Eviction
    // ------------------------------------------------------------------

    @Test
    void full_evictsLeastHitEntry() {
        cache.put(key("ada", "crewai"), "a");
        cache.put(key("bob", "crewai"), "b");
        cache.get(key("ada", "crewai"));

        cache.put(key("cy", "crewai"), "c");

        assertThat(cache.get(key("bob", "crewai"))).isEmpty();
        assertThat(cache.get(key("ada", "crewai"))).contains("a");
        assertThat(cache.get(key("cy", "crewai"))).contains("c");
        assertThat(cache.stats().evictions()).isEqualTo(1);
    }

    @Test
    void full_hitTie_evictsOldest() {
        cache.put(key("ada", "crewai"), "a");
        cache.put(key("bob", "crewai"), "b");

        cache.put(key("cy", "crewai"), "c");

        assertThat(cache.get(key("ada", "crewai"))).isEmpty();
        assertThat(cache.get(key("bob", "crewai"))).contains("b");
    }

    @Test
    void put_existingKey_replacesWithoutEviction() {
        cache.put(key("ada", "crewai"), "a");
        cache.put(key("bob", "crewai"), "b");

        cache.put(key("ada", "crewai"), "a2");

        assertThat(cache.get(key("ada", "crewai"))).contains("a2");
        assertThat(cache.stats().evictions()).isZero();
    }

    // ------------------------------------------------------------------
    // Invalidation and sweep
    // ------------------------------------------------------------------

    @Test
    void invalidate_dropsEveryEntryOfTheAgent() {
        TranslationCache<String> big = new TranslationCache<>(100, 4, TTL, Duration.ofSeconds(30), clock, meters);
        big.put(key("ada", "crewai"), "1");
        big.put(key("ada", "lmos"), "2");
        big.put(key("bob", "crewai"), "3");

        assertThat(big.invalidate("ada")).isEqualTo(2);

        assertThat(big.get(key("ada", "crewai"))).isEmpty();
        assertThat(big.get(key("bob", "crewai"))).contains("3");
    }

    @Test
    void sweepExpired_purgesOnlyExpiredEntries() {
        cache.put(key("ada", "crewai"), "old");
        clock.advance(Duration.ofMinutes(6));
        cache.put(key("bob", "crewai"), "new");
        clock.advance(Duration.ofMinutes(5));

        assertThat(cache.sweepExpired()).isEqualTo(1);

        assertThat(cache.stats().size()).isEqualTo(1);
        assertThat(cache.stats().expirations()).isEqualTo(1);
        assertThat(cache.get(key("bob", "crewai"))).contains("new");
    }

    @Test
    void startAndClose_manageSweeper() {
        cache.start();
        cache.start();
        assertThat(cache.isRunning()).isTrue();

        cache.close();
        assertThat(cache.isRunning()).isFalse();
    }

    @Test
    void constructor_rejectsNonPositiveSizes() {
        assertThatThrownBy(() -> new TranslationCache<String>(0, 1, TTL, TTL, clock, meters))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static CacheKey key(String agentId, String target) {
        return new CacheKey(agentId, "mcp", target);
    }
}
