package co.codecraft.servicebreaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * <p>Keeps one {@link CircuitBreakerStats} per service in a {@link StatsCache}, under the key
 * <code>namespace + "/" + serviceId</code>. Breakers with different policies can share a cache by using
 * different namespaces.</p>
 *
 * <p>Stats live for a sliding window. Each recorded event pushes the expiration of the whole entry out to
 * <code>now + window</code>, so a service's stats disappear only after a full window with no events at all.</p>
 *
 * <p>Concurrency: against a plain {@link StatsCache}, {@link #recordEvent(String, StatsEvent, Duration)} reads,
 * modifies and writes back without any lock. Two threads recording for the same service at the same moment
 * can lose one of the increments (last write wins). This approximation is accepted; breakers react to
 * ratios over many requests, not to exact counts. An {@link AtomicStatsCache} removes the race, and is
 * used automatically when the cache provides it. Different services never interfere with each other.</p>
 */
public class StatsStore {

    private static final Logger log = LoggerFactory.getLogger(StatsStore.class);

    /** Namespace used when none is given. */
    public static final String DEFAULT_NAMESPACE = CircuitBreaker.class.getName();

    private final StatsCache cache;
    private final String namespace;

    public StatsStore(StatsCache cache) {
        this(cache, DEFAULT_NAMESPACE);
    }

    /**
     * @param cache  May not be null.
     * @param namespace  Prefix for every key; may not be null or empty.
     */
    public StatsStore(StatsCache cache, String namespace) {
        if (cache == null) {
            throw new IllegalArgumentException("Cache cannot be null; stats would have nowhere to live.");
        }
        if (namespace == null || namespace.isEmpty()) {
            throw new IllegalArgumentException("Namespace cannot be null or empty.");
        }
        this.cache = cache;
        this.namespace = namespace;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * Record one occurrence of <code>event</code> for a service and restart the service's window.
     *
     * @param window  How long the stats should survive if nothing else happens. Must be positive.
     * @return a copy of the stats after recording.
     * @throws StatsStoreException if the cache fails.
     */
    public CircuitBreakerStats recordEvent(String serviceId, StatsEvent event, Duration window) {
        String key = keyFor(serviceId);
        try {
            CircuitBreakerStats stats;
            if (cache instanceof AtomicStatsCache) {
                stats = ((AtomicStatsCache) cache).increment(key, event, window);
            } else {
                stats = cache.get(key);
                if (stats == null) {
                    stats = new CircuitBreakerStats();
                }
                stats.add(event, 1);
                cache.set(key, stats, window);
            }
            if (log.isTraceEnabled()) {
                log.trace("event=STATS_RECORDED service={} kind={} stats=[{}]", serviceId, event, stats);
            }
            return stats;
        } catch (RuntimeException e) {
            throw new StatsStoreException(serviceId,
                    String.format("Could not record %s for service `%s`.", event, serviceId), e);
        }
    }

    /**
     * @return a copy of the service's stats, or empty stats if there are none (or they expired).
     * @throws StatsStoreException if the cache fails.
     */
    public CircuitBreakerStats get(String serviceId) {
        try {
            CircuitBreakerStats stats = cache.get(keyFor(serviceId));
            return stats == null ? new CircuitBreakerStats() : stats;
        } catch (RuntimeException e) {
            throw new StatsStoreException(serviceId,
                    String.format("Could not read stats for service `%s`.", serviceId), e);
        }
    }

    /**
     * Throw away everything recorded for a service. This is a hard reset, not a decay.
     *
     * @throws StatsStoreException if the cache fails.
     */
    public void reset(String serviceId) {
        try {
            cache.delete(keyFor(serviceId));
        } catch (RuntimeException e) {
            throw new StatsStoreException(serviceId,
                    String.format("Could not reset stats for service `%s`.", serviceId), e);
        }
        log.debug("event=STATS_RESET service={}", serviceId);
    }

    String keyFor(String serviceId) {
        return namespace + "/" + serviceId;
    }
}
