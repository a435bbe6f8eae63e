package co.codecraft.servicebreaker;

import java.time.Duration;

/**
 * <p>The key-value cache in which a {@link StatsStore} keeps each service's {@link CircuitBreakerStats}.
 * Every entry carries its own time to live; once it elapses, the entry behaves as if it had been deleted.</p>
 *
 * <p>Implementations may be local (see {@link CaffeineStatsCache}) or shared between processes. They need not
 * be transactional: {@link StatsStore} does a plain read-modify-write and tolerates lost updates unless the
 * cache also implements {@link AtomicStatsCache}. Implementations must not hand out an instance that they
 * keep, nor keep an instance that they were given; copy on the way in and on the way out.</p>
 */
public interface StatsCache {

    /**
     * @return the stats stored under <code>key</code>, or null if there are none or they have expired.
     */
    CircuitBreakerStats get(String key);

    /**
     * Store <code>stats</code> under <code>key</code>, replacing whatever was there, and make the entry expire
     * <code>expiresAfter</code> from now.
     */
    void set(String key, CircuitBreakerStats stats, Duration expiresAfter);

    /**
     * Remove the entry under <code>key</code>, if any.
     */
    void delete(String key);
}
