package co.codecraft.servicebreaker;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LoggingCircuitBreakerListenerTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private LoggingCircuitBreakerListener listener;

    @Before
    public void setUp() {
        logger = (Logger) LoggerFactory.getLogger("servicebreaker.test");
        logger.setLevel(Level.DEBUG);
        appender = new ListAppender<ILoggingEvent>();
        appender.start();
        logger.addAppender(appender);
        listener = new LoggingCircuitBreakerListener(logger);
    }

    @After
    public void tearDown() {
        logger.detachAppender(appender);
    }

    private ILoggingEvent last() {
        return appender.list.get(appender.list.size() - 1);
    }

    @Test(expected=IllegalArgumentException.class)
    public void logger_may_not_be_null() {
        new LoggingCircuitBreakerListener(null);
    }

    @Test
    public void levels_match_severity() {
        CircuitBreakerStats stats = new CircuitBreakerStats(1, 2, 0);

        listener.onBreakerTripped("svc", stats, CircuitStatus.CLOSED);
        assertEquals(Level.ERROR, last().getLevel());

        listener.onBreakerTheoreticallyTripped("svc", stats, CircuitStatus.CLOSED);
        assertEquals(Level.WARN, last().getLevel());

        listener.onRequestRejected("svc", stats, "GET https://svc/x");
        assertEquals(Level.WARN, last().getLevel());

        listener.onBreakerReset("svc", stats, CircuitStatus.OPEN);
        assertEquals(Level.INFO, last().getLevel());

        listener.onRequestTheoreticallyRejected("svc", stats, "GET https://svc/x");
        assertEquals(Level.INFO, last().getLevel());

        listener.onBreakerClosing("svc", stats);
        assertEquals(Level.DEBUG, last().getLevel());

        assertEquals(6, appender.list.size());
    }

    @Test
    public void messages_carry_service_and_stats() {
        listener.onBreakerTripped("svc", new CircuitBreakerStats(1, 2, 0), CircuitStatus.CLOSED);
        String msg = last().getFormattedMessage();
        assertTrue(msg, msg.startsWith("event=BREAKER_TRIPPED service=svc previous_status=CLOSED"));
        assertTrue(msg, msg.contains("{successes=1, failures=2, rejections=0}"));

        listener.onRequestRejected("svc", new CircuitBreakerStats(), "GET https://svc/x");
        assertTrue(last().getFormattedMessage().contains("request=\"GET https://svc/x\""));
    }

    @Test
    public void works_as_a_breaker_listener() throws OpenCircuitException {
        CircuitBreaker<String> cb = new CircuitBreaker<String>(new StatsStore(new MapStatsCache()));
        cb.addListener(listener);
        for (int i = 0; i < 3; ++i) {
            cb.recordOutcome("svc", cb.decide("svc", "r"), true);
        }
        assertEquals(1, appender.list.size());
        assertTrue(last().getFormattedMessage().startsWith("event=BREAKER_TRIPPED"));
    }
}
