package co.codecraft.servicebreaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every breaker event to an SLF4J logger. A trip is an ERROR; a theoretical trip and a rejection are
 * WARN; resets and theoretical rejections are INFO; closing is DEBUG.
 */
public class LoggingCircuitBreakerListener implements CircuitBreakerListener<Object> {

    private final Logger logger;

    public LoggingCircuitBreakerListener() {
        this(LoggerFactory.getLogger(LoggingCircuitBreakerListener.class));
    }

    /**
     * @param logger  May not be null.
     */
    public LoggingCircuitBreakerListener(Logger logger) {
        if (logger == null) {
            throw new IllegalArgumentException("Logger cannot be null.");
        }
        this.logger = logger;
    }

    @Override
    public void onBreakerReset(String serviceId, CircuitBreakerStats stats, CircuitStatus previousStatus) {
        logger.info("event=BREAKER_RESET service={} previous_status={} stats={} "
                        + "msg=\"Requests will be allowed to this service again.\"",
                serviceId, previousStatus, stats.toMap());
    }

    @Override
    public void onBreakerTripped(String serviceId, CircuitBreakerStats stats, CircuitStatus previousStatus) {
        logger.error("event=BREAKER_TRIPPED service={} previous_status={} stats={} "
                        + "msg=\"No further requests to this service will be allowed until the breaker is reset.\"",
                serviceId, previousStatus, stats.toMap());
    }

    @Override
    public void onBreakerTheoreticallyTripped(String serviceId, CircuitBreakerStats stats,
                                              CircuitStatus previousStatus) {
        logger.warn("event=BREAKER_THEORETICALLY_TRIPPED service={} previous_status={} stats={} "
                        + "msg=\"The breaker would have tripped, but it is not enabled.\"",
                serviceId, previousStatus, stats.toMap());
    }

    @Override
    public void onRequestRejected(String serviceId, CircuitBreakerStats stats, Object request) {
        logger.warn("event=REQUEST_REJECTED service={} request=\"{}\" stats={}",
                serviceId, request, stats.toMap());
    }

    @Override
    public void onRequestTheoreticallyRejected(String serviceId, CircuitBreakerStats stats, Object request) {
        logger.info("event=REQUEST_THEORETICALLY_REJECTED service={} request=\"{}\" stats={} "
                        + "msg=\"The request would have been rejected, but the breaker is not enabled.\"",
                serviceId, request, stats.toMap());
    }

    @Override
    public void onBreakerClosing(String serviceId, CircuitBreakerStats stats) {
        logger.debug("event=BREAKER_CLOSING service={} stats={}", serviceId, stats.toMap());
    }
}
