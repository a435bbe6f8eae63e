package co.codecraft.servicebreaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * <p>Stops sending requests to a downstream service once too many of its recent requests have failed, and
 * lets them flow again once the bad results age out of the window. Callers get an immediate
 * {@link OpenCircuitException} instead of waiting on a service that is already struggling.</p>
 *
 * <h3>Key Concepts</h3>
 *
 * <p>One breaker guards many services. Each request is mapped to a <em>service identifier</em> (see
 * {@link ServiceIdentifier}), and everything the breaker knows about that service lives in a
 * {@link CircuitBreakerStats} kept by a {@link StatsStore}: how many requests succeeded, failed, or were
 * rejected during the current <em>consideration window</em>.</p>
 *
 * <p>The breaker itself holds no per-service state. A service's {@link CircuitStatus status} is recomputed
 * from its stats and the current {@link CircuitBreakerConfig} every time it is needed:</p>
 *
 * <pre>
 *    OPEN    if requestsSentToService &gt;= minRequests AND failureRatio &gt;= failureThreshold
 *    CLOSED  otherwise
 * </pre>
 *
 * <p>There is no timer. An open circuit stays open until enough successes pull the failure ratio back under
 * the threshold, until {@link #reset(String)} is called, or until the service goes quiet for a whole
 * window and its stats expire. {@link CircuitStatus#CLOSING} exists for listeners but is never derived.</p>
 *
 * <p>A breaker may be disabled. A disabled breaker keeps gathering stats and keeps telling its listeners what
 * it <em>would</em> have done ("theoretical" trips and rejections), but never blocks a request. This makes
 * it safe to roll out a new breaker and watch its logs before letting it act.</p>
 *
 * <p>Status changes and rejections are reported to every registered {@link CircuitBreakerListener} on the
 * thread that caused them.</p>
 *
 * <h3>Concurrency</h3>
 *
 * <p>Request handling takes no lock. Requests to different services never touch the same state. Requests to the
 * same service race only inside the {@link StatsStore}, where a lost increment is an accepted approximation
 * (or impossible, with an {@link AtomicStatsCache}). The config is swapped atomically as a whole. Each
 * request reads it once, in {@code decide}, and carries it to {@code recordOutcome} inside its
 * {@link CircuitDecision}, so a change made mid-request applies from the next request on. The listener list
 * is also replaced as a whole; a dispatch sees either the old list or the new one.</p>
 *
 * <h3>Typical usage scenario</h3>
 *
 * <p>Most callers use a {@link CircuitBreakerInterceptor}, which runs the protocol below around a
 * {@link Transport}. Doing it by hand looks like this:</p>
 *
 * <pre>
 *    String serviceId = identifier.getServiceIdentifier(request);
 *    // Throws OpenCircuitException if the circuit is open and the breaker is enabled.
 *    CircuitDecision decision = breaker.{@link #decide(String, Object) decide(serviceId, request)};
 *    Response response = send(request);
 *    breaker.{@link #recordOutcome(String, CircuitDecision, boolean) recordOutcome(serviceId, decision, isFailure(response))};
 * </pre>
 *
 * @param <Q>  The type of request, as seen by listeners.
 */
public class CircuitBreaker<Q> {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final StatsStore store;

    private volatile CircuitBreakerConfig config;

    // Mutators hold the lock and publish a whole new list; dispatch reads the field once, unlocked.
    private volatile List<CircuitBreakerListener<? super Q>> listeners =
            new CopyOnWriteArrayList<CircuitBreakerListener<? super Q>>();

    /**
     * Create a breaker with the default config: 50% failures over at least 3 requests, a 15 minute window,
     * enabled.
     *
     * @param store  May not be null.
     */
    public CircuitBreaker(StatsStore store) {
        this(store, CircuitBreakerConfig.defaults());
    }

    /**
     * @param store  May not be null.
     * @param config  May not be null.
     */
    public CircuitBreaker(StatsStore store, CircuitBreakerConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("Store cannot be null; circuit breaker would have no stats to decide with.");
        }
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null; circuit breaker would not know when to trip.");
        }
        this.store = store;
        this.config = config;
    }

    /**
     * @return OPEN if the service's stats cross the configured thresholds, CLOSED otherwise. Calling this has no
     *     side effects; it never notifies anyone.
     */
    public CircuitStatus getStatus(String serviceId) {
        return statusOf(readStats(serviceId), config);
    }

    /**
     * @return a copy of what has been recorded for the service in its current window. Empty if nothing has.
     */
    public CircuitBreakerStats getStats(String serviceId) {
        return readStats(serviceId);
    }

    /**
     * The threshold rule, in one place.
     */
    static CircuitStatus statusOf(CircuitBreakerStats stats, CircuitBreakerConfig config) {
        if (stats.getRequestsSentToService() >= config.minRequests
                && stats.getFailureRatio() >= config.failureThreshold) {
            return CircuitStatus.OPEN;
        }
        return CircuitStatus.CLOSED;
    }

    /**
     * <p>Decide, before sending it, whether a request may go through.</p>
     *
     * <p>If the service's circuit is open, listeners hear about the rejection. An enabled breaker then throws;
     * a disabled one only reports a theoretical rejection and lets the request through.</p>
     *
     * @return the status seen while deciding and the config it was judged under. Pass it back to
     *     {@link #recordOutcome(String, CircuitDecision, boolean)} so that a change can be detected.
     * @throws OpenCircuitException if the circuit is open and the breaker is enabled.
     */
    public CircuitDecision decide(String serviceId, Q request) throws OpenCircuitException {
        CircuitBreakerConfig cfg = config;
        CircuitBreakerStats stats = readStats(serviceId);
        CircuitStatus status = statusOf(stats, cfg);
        if (status != CircuitStatus.OPEN) {
            return new CircuitDecision(status, cfg);
        }
        if (cfg.enabled) {
            if (cfg.countRejections) {
                CircuitBreakerStats recorded = recordEvent(serviceId, StatsEvent.REJECTION, cfg);
                if (recorded != null) {
                    stats = recorded;
                }
            }
            for (CircuitBreakerListener<? super Q> listener : listeners) {
                listener.onRequestRejected(serviceId, stats, request);
            }
            throw new OpenCircuitException(serviceId, request);
        }
        for (CircuitBreakerListener<? super Q> listener : listeners) {
            listener.onRequestTheoreticallyRejected(serviceId, stats, request);
        }
        return new CircuitDecision(status, cfg);
    }

    /**
     * Tell the breaker how a request it allowed turned out. The outcome is recorded, the status recomputed under
     * the decision's config, and if it differs from the decision's status every listener is notified before this
     * method returns.
     *
     * @param decision  What {@link #decide(String, Object)} returned for this request.
     * @param isFailure  Whether the outcome counts against the service.
     * @return the transition that happened, or null if the status did not change (or the outcome could not be
     *     recorded).
     */
    public CircuitTransition recordOutcome(String serviceId, CircuitDecision decision, boolean isFailure) {
        if (decision == null) {
            throw new IllegalArgumentException("Decision cannot be null.");
        }
        CircuitBreakerConfig cfg = decision.config;
        CircuitStatus previousStatus = decision.status;
        CircuitBreakerStats stats = recordEvent(serviceId, isFailure ? StatsEvent.FAILURE : StatsEvent.SUCCESS, cfg);
        if (stats == null) {
            return null;
        }
        CircuitStatus newStatus = statusOf(stats, cfg);
        if (newStatus == previousStatus) {
            return null;
        }
        CircuitTransition transition = new CircuitTransition(serviceId, previousStatus, newStatus, stats);
        announce(transition, cfg);
        return transition;
    }

    /**
     * Throw away the service's stats, closing its circuit. If the circuit was open, listeners are told it
     * has been reset.
     *
     * @throws StatsStoreException if the stats could not be deleted.
     */
    public void reset(String serviceId) {
        CircuitBreakerConfig cfg = config;
        CircuitStatus previousStatus = statusOf(readStats(serviceId), cfg);
        store.reset(serviceId);
        if (previousStatus != CircuitStatus.CLOSED) {
            announce(new CircuitTransition(serviceId, previousStatus, CircuitStatus.CLOSED, new CircuitBreakerStats()), cfg);
        }
    }

    private void announce(CircuitTransition transition, CircuitBreakerConfig cfg) {
        log.debug("event=CIRCUIT_TRANSITION service={} from={} to={} enabled={}",
                transition.serviceId, transition.previousStatus, transition.newStatus, cfg.enabled);
        for (CircuitBreakerListener<? super Q> listener : listeners) {
            transition.deliverTo(listener, cfg.enabled);
        }
    }

    // A broken store must never block traffic: treat the service as having no stats, which means CLOSED.
    private CircuitBreakerStats readStats(String serviceId) {
        try {
            return store.get(serviceId);
        } catch (StatsStoreException e) {
            log.warn("event=STATS_UNAVAILABLE service={} assuming={} message={}",
                    serviceId, CircuitStatus.CLOSED, e.getMessage(), e);
            return new CircuitBreakerStats();
        }
    }

    private CircuitBreakerStats recordEvent(String serviceId, StatsEvent event, CircuitBreakerConfig cfg) {
        try {
            return store.recordEvent(serviceId, event, cfg.considerationWindow);
        } catch (StatsStoreException e) {
            log.warn("event=STATS_UNAVAILABLE service={} dropped={} message={}",
                    serviceId, event, e.getMessage(), e);
            return null;
        }
    }

    /**
     * @return true if the circuit for the service is closed, i.e. the breaker is NOT tripped and requests will
     *     be allowed through.
     */
    public boolean isClosed(String serviceId) {
        return getStatus(serviceId) == CircuitStatus.CLOSED;
    }

    /**
     * @return true if the circuit for the service is open, i.e. the breaker is tripped and requests will NOT be
     *     allowed through (unless the breaker is disabled).
     */
    public boolean isOpen(String serviceId) {
        return getStatus(serviceId) == CircuitStatus.OPEN;
    }

    /**
     * @return true if the circuit for the service is closing. Always false for now; see {@link CircuitStatus#CLOSING}.
     */
    public boolean isClosing(String serviceId) {
        return getStatus(serviceId) == CircuitStatus.CLOSING;
    }

    public boolean isAllowingRequests(String serviceId) {
        return getStatus(serviceId).isAllowingRequests();
    }

    public boolean isRejectingRequests(String serviceId) {
        return !isAllowingRequests(serviceId);
    }

    /** Same as {@link #isOpen(String)}. */
    public boolean isTripped(String serviceId) {
        return isOpen(serviceId);
    }

    public void addListener(CircuitBreakerListener<? super Q> listener) {
        addListeners(Collections.singletonList(listener));
    }

    public synchronized void addListeners(Collection<? extends CircuitBreakerListener<? super Q>> more) {
        checkListeners(more);
        List<CircuitBreakerListener<? super Q>> updated =
                new CopyOnWriteArrayList<CircuitBreakerListener<? super Q>>(listeners);
        updated.addAll(more);
        listeners = updated;
    }

    /**
     * Replace every registered listener with <code>replacements</code>. A notification running concurrently
     * reaches either the old listeners or the new ones, never neither.
     */
    public synchronized void setListeners(Collection<? extends CircuitBreakerListener<? super Q>> replacements) {
        checkListeners(replacements);
        listeners = new CopyOnWriteArrayList<CircuitBreakerListener<? super Q>>(replacements);
    }

    public synchronized boolean removeListener(CircuitBreakerListener<? super Q> listener) {
        List<CircuitBreakerListener<? super Q>> updated =
                new CopyOnWriteArrayList<CircuitBreakerListener<? super Q>>(listeners);
        boolean removed = updated.remove(listener);
        listeners = updated;
        return removed;
    }

    private static void checkListeners(Collection<?> candidates) {
        if (candidates == null) {
            throw new IllegalArgumentException("Listeners cannot be null.");
        }
        for (Object listener : candidates) {
            if (listener == null) {
                throw new IllegalArgumentException("Listener cannot be null.");
            }
        }
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    /**
     * Replace the whole config. Requests already past {@link #decide(String, Object)} finish under the old one,
     * which their {@link CircuitDecision} carries.
     */
    public synchronized void setConfig(CircuitBreakerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null.");
        }
        this.config = config;
        log.info("event=CONFIG_CHANGED config=[{}]", config);
    }

    /**
     * Controls whether the breaker is enabled. If disabled, stats are still gathered and potential events are
     * still reported, but the circuit never blocks a request.
     */
    public synchronized void setEnabled(boolean enabled) {
        setConfig(config.toBuilder().setEnabled(enabled).build());
    }

    public synchronized void setFailureThreshold(int failureThreshold) {
        setConfig(config.toBuilder().setFailureThreshold(failureThreshold).build());
    }

    public synchronized void setMinRequests(int minRequests) {
        setConfig(config.toBuilder().setMinRequests(minRequests).build());
    }

    public synchronized void setConsiderationWindow(Duration considerationWindow) {
        setConfig(config.toBuilder().setConsiderationWindow(considerationWindow).build());
    }

    public boolean isEnabled() {
        return config.enabled;
    }
}
