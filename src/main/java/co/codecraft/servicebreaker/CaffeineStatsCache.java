package co.codecraft.servicebreaker;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.BiFunction;

/**
 * <p>An in-process {@link AtomicStatsCache} backed by Caffeine. Each entry remembers the time to live it was
 * written with, and a variable {@link Expiry} applies that value on every create and update (reads leave it
 * alone). That is exactly the sliding window {@link StatsStore} needs.</p>
 *
 * <p>Increments run inside <code>asMap().compute()</code>, which Caffeine executes atomically per key, so
 * concurrent events for one service are all counted. An expired entry is treated as absent by the compute,
 * so an increment after a quiet window starts again from zero.</p>
 *
 * <p>Because the cache is local, breakers in different processes keep separate stats.</p>
 */
public class CaffeineStatsCache implements AtomicStatsCache {

    private static final Logger log = LoggerFactory.getLogger(CaffeineStatsCache.class);

    /** Upper bound on the number of services tracked when none is given. */
    public static final long DEFAULT_MAXIMUM_SIZE = 10000;

    private static final Duration MAX_TTL = Duration.ofNanos(Long.MAX_VALUE);

    private final Cache<String, Entry> cache;

    public CaffeineStatsCache() {
        this(DEFAULT_MAXIMUM_SIZE, Ticker.systemTicker());
    }

    /**
     * @param maximumSize  How many services to track before Caffeine starts evicting. Must be positive.
     * @param ticker  Time source for expiration. May not be null; tests pass a fake one.
     */
    public CaffeineStatsCache(long maximumSize, Ticker ticker) {
        if (maximumSize < 1) {
            throw new IllegalArgumentException("maximumSize must be >= 1");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("Ticker cannot be null.");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new EntryExpiry())
                .build();
        log.info("Caffeine stats cache configured: maxSize={}", maximumSize);
    }

    @Override
    public CircuitBreakerStats get(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? null : entry.stats.copy();
    }

    @Override
    public void set(String key, CircuitBreakerStats stats, Duration expiresAfter) {
        cache.put(key, new Entry(stats.copy(), ttlNanos(expiresAfter)));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public CircuitBreakerStats increment(String key, final StatsEvent event, Duration expiresAfter) {
        final long ttl = ttlNanos(expiresAfter);
        Entry updated = cache.asMap().compute(key, new BiFunction<String, Entry, Entry>() {
            @Override
            public Entry apply(String k, Entry existing) {
                // Never mutate the old entry; a concurrent get() may be copying it.
                CircuitBreakerStats stats = existing == null ? new CircuitBreakerStats() : existing.stats.copy();
                stats.add(event, 1);
                return new Entry(stats, ttl);
            }
        });
        return updated.stats.copy();
    }

    /**
     * @return an estimate of how many services currently have stats.
     */
    public long estimatedSize() {
        return cache.estimatedSize();
    }

    // Anything too long to count in nanoseconds never expires.
    static long ttlNanos(Duration expiresAfter) {
        if (expiresAfter.compareTo(MAX_TTL) > 0) {
            return Long.MAX_VALUE;
        }
        return expiresAfter.toNanos();
    }

    private static final class Entry {
        final CircuitBreakerStats stats;
        final long ttlNanos;

        Entry(CircuitBreakerStats stats, long ttlNanos) {
            this.stats = stats;
            this.ttlNanos = ttlNanos;
        }
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
