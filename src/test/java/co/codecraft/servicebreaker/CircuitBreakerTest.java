package co.codecraft.servicebreaker;

import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static co.codecraft.servicebreaker.CircuitStatus.CLOSED;
import static co.codecraft.servicebreaker.CircuitStatus.OPEN;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CircuitBreakerTest {

    private static final String SVC = "GET https://svc/x";

    private FakeTicker ticker;
    private CircuitBreaker<String> cb;
    private CapturingListener listener;

    @Before
    public void setUp() {
        ticker = new FakeTicker();
        cb = new CircuitBreaker<String>(new StatsStore(new CaffeineStatsCache(100, ticker)));
        listener = new CapturingListener();
        cb.addListener(listener);
    }

    /** Simulate one allowed request with the given outcome. */
    private CircuitTransition pulse(String serviceId, boolean isFailure) throws OpenCircuitException {
        CircuitDecision decision = cb.decide(serviceId, "request");
        return cb.recordOutcome(serviceId, decision, isFailure);
    }

    @Test(expected=IllegalArgumentException.class)
    public void store_may_not_be_null() {
        new CircuitBreaker<String>(null);
    }

    @Test(expected=IllegalArgumentException.class)
    public void config_may_not_be_null() {
        new CircuitBreaker<String>(new StatsStore(new MapStatsCache()), null);
    }

    @Test
    public void unknown_service_is_closed() {
        assertEquals(CLOSED, cb.getStatus("nobody"));
        assertTrue(cb.isClosed("nobody"));
        assertTrue(cb.isAllowingRequests("nobody"));
        assertFalse(cb.isRejectingRequests("nobody"));
        assertFalse(cb.isClosing("nobody"));
    }

    @Test
    public void trips_exactly_at_min_requests() throws OpenCircuitException {
        assertNull(pulse(SVC, true));
        assertNull(pulse(SVC, true));
        assertEquals(CLOSED, cb.getStatus(SVC));
        CircuitTransition t = pulse(SVC, true);
        assertNotNull(t);
        assertEquals(CLOSED, t.previousStatus);
        assertEquals(OPEN, t.newStatus);
        assertEquals(new CircuitBreakerStats(0, 3, 0), t.stats);
        assertTrue(cb.isOpen(SVC));
        assertTrue(cb.isTripped(SVC));
        listener.assertEvents("tripped-from-CLOSED " + SVC);
    }

    @Test
    public void two_failures_of_three_open_the_circuit() throws OpenCircuitException {
        pulse(SVC, true);
        pulse(SVC, true);
        pulse(SVC, false);
        CircuitBreakerStats s = cb.getStats(SVC);
        assertEquals(3, s.getRequestsSentToService());
        assertEquals(67, s.getFailureRatio());
        assertEquals(OPEN, cb.getStatus(SVC));

        try {
            cb.decide(SVC, "fourth");
            fail("expected OpenCircuitException");
        } catch (OpenCircuitException e) {
            assertEquals(SVC, e.getServiceId());
            assertEquals("fourth", e.getRequest());
        }
        listener.assertEvents("tripped-from-CLOSED " + SVC, "rejected " + SVC);
        assertEquals(Arrays.asList((Object) "fourth"), listener.requests);
    }

    @Test
    public void one_failure_of_three_stays_closed() throws OpenCircuitException {
        pulse(SVC, true);
        pulse(SVC, false);
        pulse(SVC, false);
        assertEquals(33, cb.getStats(SVC).getFailureRatio());
        assertEquals(CLOSED, cb.decide(SVC, "fourth").status);
        assertTrue(listener.events.isEmpty());
    }

    @Test
    public void status_matches_threshold_rule() {
        CircuitBreakerConfig cfg = CircuitBreakerConfig.builder().setMinRequests(4).setFailureThreshold(25).build();
        for (int successes = 0; successes < 8; ++successes) {
            for (int failures = 0; failures < 8; ++failures) {
                CircuitBreakerStats s = new CircuitBreakerStats(successes, failures, 0);
                boolean open = s.getRequestsSentToService() >= 4 && s.getFailureRatio() >= 25;
                assertEquals(s.toString(), open ? OPEN : CLOSED, CircuitBreaker.statusOf(s, cfg));
            }
        }
    }

    @Test
    public void successes_close_an_open_circuit() throws OpenCircuitException {
        cb.setEnabled(false); // so requests keep flowing while open
        pulse(SVC, true);
        pulse(SVC, true);
        pulse(SVC, true);
        assertEquals(OPEN, cb.getStatus(SVC));
        // 3 failures of 6 is still 50%; the 7th request tips it.
        pulse(SVC, false);
        pulse(SVC, false);
        pulse(SVC, false);
        assertEquals(OPEN, cb.getStatus(SVC));
        CircuitTransition t = pulse(SVC, false);
        assertEquals(CLOSED, t.newStatus);
        assertEquals(43, t.stats.getFailureRatio());
        assertEquals(1, listener.count("theoretically-tripped-from-CLOSED"));
        assertEquals(1, listener.count("reset-from-OPEN"));
    }

    @Test
    public void disabled_breaker_never_rejects() throws OpenCircuitException {
        cb.setEnabled(false);
        pulse(SVC, true);
        pulse(SVC, true);
        pulse(SVC, true);
        for (int i = 0; i < 5; ++i) {
            assertEquals(OPEN, cb.decide(SVC, "req" + i).status);
        }
        assertEquals(0, listener.count("tripped"));
        assertEquals(1, listener.count("theoretically-tripped"));
        assertEquals(5, listener.count("theoretically-rejected"));
        assertEquals(0, listener.count("rejected"));
    }

    @Test
    public void open_persists_until_window_expires() throws OpenCircuitException {
        pulse(SVC, true);
        pulse(SVC, true);
        pulse(SVC, true);
        ticker.advance(Duration.ofMinutes(14));
        assertEquals(OPEN, cb.getStatus(SVC));
        ticker.advance(Duration.ofMinutes(2));
        assertEquals(CLOSED, cb.getStatus(SVC));
        assertEquals(CLOSED, cb.decide(SVC, "after").status);
    }

    @Test
    public void reset_closes_and_notifies() throws OpenCircuitException {
        pulse(SVC, true);
        pulse(SVC, true);
        pulse(SVC, true);
        cb.reset(SVC);
        assertEquals(CLOSED, cb.getStatus(SVC));
        assertEquals(new CircuitBreakerStats(), cb.getStats(SVC));
        listener.assertEvents("tripped-from-CLOSED " + SVC, "reset-from-OPEN " + SVC);

        // Resetting a closed service is silent.
        cb.reset(SVC);
        cb.reset("nobody");
        assertEquals(2, listener.events.size());
    }

    @Test
    public void get_status_is_idempotent_and_silent() throws OpenCircuitException {
        pulse(SVC, true);
        pulse(SVC, true);
        pulse(SVC, true);
        int before = listener.events.size();
        for (int i = 0; i < 10; ++i) {
            assertEquals(OPEN, cb.getStatus(SVC));
        }
        assertEquals(before, listener.events.size());
        assertEquals(new CircuitBreakerStats(0, 3, 0), cb.getStats(SVC));
    }

    @Test
    public void unchanged_status_is_not_announced() {
        CircuitDecision closed = new CircuitDecision(CLOSED, cb.getConfig());
        assertNull(cb.recordOutcome(SVC, closed, false));
        assertNull(cb.recordOutcome(SVC, closed, true));
        assertTrue(listener.events.isEmpty());
    }

    @Test(expected=IllegalArgumentException.class)
    public void decision_may_not_be_null() {
        cb.recordOutcome(SVC, null, true);
    }

    @Test
    public void outcome_is_judged_under_the_config_that_admitted_it() throws OpenCircuitException {
        pulse(SVC, true);
        pulse(SVC, true);
        CircuitDecision inFlight = cb.decide(SVC, "third");
        assertEquals(CLOSED, inFlight.status);
        assertEquals(3, inFlight.config.minRequests);

        cb.setMinRequests(10);
        CircuitTransition t = cb.recordOutcome(SVC, inFlight, true);
        assertNotNull(t);
        assertEquals(OPEN, t.newStatus);
        listener.assertEvents("tripped-from-CLOSED " + SVC);

        // The next request sees the new config.
        assertEquals(CLOSED, cb.decide(SVC, "fourth").status);
    }

    @Test
    public void config_changes_apply_to_next_decision() throws OpenCircuitException {
        pulse(SVC, true);
        pulse(SVC, false);
        pulse(SVC, false);
        assertEquals(CLOSED, cb.getStatus(SVC));
        cb.setFailureThreshold(30);
        assertEquals(OPEN, cb.getStatus(SVC));
        cb.setMinRequests(4);
        assertEquals(CLOSED, cb.getStatus(SVC));
        cb.setConsiderationWindow(Duration.ofMinutes(1));
        assertEquals(Duration.ofMinutes(1), cb.getConfig().considerationWindow);
        assertEquals(30, cb.getConfig().failureThreshold);
        assertTrue(cb.isEnabled());
    }

    @Test
    public void rejections_are_counted_only_when_configured() throws OpenCircuitException {
        pulse(SVC, true);
        pulse(SVC, true);
        pulse(SVC, true);
        try {
            cb.decide(SVC, "r");
            fail("expected OpenCircuitException");
        } catch (OpenCircuitException expected) {
        }
        assertEquals(0, cb.getStats(SVC).getRejections());

        cb.setConfig(cb.getConfig().toBuilder().setCountRejections(true).build());
        try {
            cb.decide(SVC, "r");
            fail("expected OpenCircuitException");
        } catch (OpenCircuitException expected) {
        }
        assertEquals(1, cb.getStats(SVC).getRejections());
        assertEquals(1, listener.stats.get(listener.stats.size() - 1).getRejections());
    }

    @Test
    public void identities_have_separate_circuits() throws OpenCircuitException {
        pulse("a", true);
        pulse("a", true);
        pulse("a", true);
        pulse("b", false);
        assertEquals(OPEN, cb.getStatus("a"));
        assertEquals(CLOSED, cb.getStatus("b"));
        assertEquals(CLOSED, cb.decide("b", "ok").status);
    }

    @Test
    public void store_outage_fails_open() throws OpenCircuitException {
        StatsCache broken = new StatsCache() {
            @Override
            public CircuitBreakerStats get(String key) {
                throw new IllegalStateException("cache down");
            }
            @Override
            public void set(String key, CircuitBreakerStats stats, Duration expiresAfter) {
                throw new IllegalStateException("cache down");
            }
            @Override
            public void delete(String key) {
                throw new IllegalStateException("cache down");
            }
        };
        CircuitBreaker<String> outage = new CircuitBreaker<String>(new StatsStore(broken));
        outage.addListener(listener);
        for (int i = 0; i < 5; ++i) {
            CircuitDecision decision = outage.decide(SVC, "r");
            assertEquals(CLOSED, decision.status);
            assertNull(outage.recordOutcome(SVC, decision, true));
        }
        assertEquals(CLOSED, outage.getStatus(SVC));
        assertTrue(listener.events.isEmpty());
        try {
            outage.reset(SVC);
            fail("expected StatsStoreException");
        } catch (StatsStoreException expected) {
        }
    }

    @Test
    public void listeners_can_be_replaced_and_removed() throws OpenCircuitException {
        CapturingListener second = new CapturingListener();
        cb.setListeners(Arrays.asList(second));
        pulse(SVC, true);
        pulse(SVC, true);
        pulse(SVC, true);
        assertTrue(listener.events.isEmpty());
        assertEquals(1, second.events.size());

        assertTrue(cb.removeListener(second));
        cb.addListeners(Arrays.asList(listener));
        cb.reset(SVC);
        assertEquals(1, second.events.size());
        listener.assertEvents("reset-from-OPEN " + SVC);
    }

    @Test(expected=IllegalArgumentException.class)
    public void null_listener_is_rejected() {
        cb.addListener(null);
    }

    @Test(expected=IllegalArgumentException.class)
    public void null_replacement_listener_is_rejected() {
        cb.setListeners(Arrays.asList(listener, null));
    }

    @Test
    public void replacing_listeners_never_drops_a_notification() throws Exception {
        cb.setEnabled(false);
        pulse(SVC, true);
        pulse(SVC, true);
        pulse(SVC, true);
        final AtomicLong delivered = new AtomicLong();
        final CircuitBreakerListener<Object> counting = new CapturingListener() {
            @Override
            public void onRequestTheoreticallyRejected(String serviceId, CircuitBreakerStats s, Object request) {
                delivered.incrementAndGet();
            }
        };
        cb.setListeners(Arrays.asList(counting));
        final AtomicBoolean done = new AtomicBoolean();
        Thread swapper = new Thread(new Runnable() {
            @Override
            public void run() {
                while (!done.get()) {
                    cb.setListeners(Arrays.asList(counting));
                }
            }
        });
        swapper.start();
        int decisions = 20000;
        try {
            for (int i = 0; i < decisions; ++i) {
                cb.decide(SVC, "r");
            }
        } finally {
            done.set(true);
            swapper.join();
        }
        assertEquals(decisions, delivered.get());
    }

    @Test
    public void closing_transition_reaches_closing_callback() {
        CircuitTransition t = new CircuitTransition(SVC, OPEN, CircuitStatus.CLOSING, new CircuitBreakerStats());
        t.deliverTo(listener, true);
        listener.assertEvents("closing " + SVC);
        assertTrue(CircuitStatus.CLOSING.isAllowingRequests());
        assertFalse(OPEN.isAllowingRequests());
    }

    @Test
    public void listener_exceptions_propagate() throws OpenCircuitException {
        final RuntimeException boom = new IllegalStateException("listener bug");
        cb.addListener(new CapturingListener() {
            @Override
            public void onBreakerTripped(String serviceId, CircuitBreakerStats s, CircuitStatus previousStatus) {
                throw boom;
            }
        });
        pulse(SVC, true);
        pulse(SVC, true);
        try {
            pulse(SVC, true);
            fail("expected listener exception");
        } catch (IllegalStateException e) {
            assertSame(boom, e);
        }
    }
}
