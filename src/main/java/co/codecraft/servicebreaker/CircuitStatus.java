package co.codecraft.servicebreaker;


/**
 * Describe the current condition of the breaker for one service. A status is always derived from the
 * service's {@link CircuitBreakerStats} and the breaker's {@link CircuitBreakerConfig}; it is never stored.
 */
public enum CircuitStatus {

    /** The circuit is closed. Requests are allowed through; the service is healthy. */
    CLOSED,

    /** The circuit is open (tripped by too many failures). Requests are rejected without being sent. */
    OPEN,

    /**
     * The circuit is on its way from OPEN back to CLOSED, and some requests are allowed through while the
     * service is tested. Listeners can receive this status, but {@link CircuitBreaker#getStatus(String)}
     * never derives it: there is no half-open policy yet.
     */
    CLOSING;

    /**
     * @return true if requests should be sent to the service while in this status.
     */
    public boolean isAllowingRequests() {
        return this != OPEN;
    }
}
