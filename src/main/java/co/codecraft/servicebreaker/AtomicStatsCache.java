package co.codecraft.servicebreaker;

import java.time.Duration;

/**
 * A {@link StatsCache} that can increment a counter in one atomic step. When a {@link StatsStore} sees this
 * interface, it delegates increments here instead of doing its own read-modify-write, so concurrent events
 * for the same service are never lost.
 */
public interface AtomicStatsCache extends StatsCache {

    /**
     * Atomically add one to the counter that matches <code>event</code> in the entry under <code>key</code>
     * (starting from empty stats if there is no live entry), and make the whole entry expire
     * <code>expiresAfter</code> from now.
     *
     * @return a copy of the stats after the increment.
     */
    CircuitBreakerStats increment(String key, StatsEvent event, Duration expiresAfter);
}
