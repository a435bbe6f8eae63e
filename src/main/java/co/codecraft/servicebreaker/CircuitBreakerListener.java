package co.codecraft.servicebreaker;

/**
 * Receive notifications when interesting things happen to the breaker for a service. Callbacks run
 * synchronously on the thread handling the request, before the response is returned, so processing these
 * events should be very fast and light. Exceptions thrown here propagate to the caller.
 *
 * @param <Q>  The type of request the breaker guards.
 */
public interface CircuitBreakerListener<Q> {

    /**
     * Called when the breaker is reset, i.e. the circuit is closed again and requests will be allowed through.
     *
     * @param serviceId  The service whose breaker changed.
     * @param stats  The service's stats at the moment of the change.
     * @param previousStatus  What the status was before.
     */
    void onBreakerReset(String serviceId, CircuitBreakerStats stats, CircuitStatus previousStatus);

    /**
     * Called when the breaker trips, i.e. the circuit opens and requests will NOT be allowed through.
     */
    void onBreakerTripped(String serviceId, CircuitBreakerStats stats, CircuitStatus previousStatus);

    /**
     * Called when the breaker would have tripped, but did not because it is not enabled.
     */
    void onBreakerTheoreticallyTripped(String serviceId, CircuitBreakerStats stats, CircuitStatus previousStatus);

    /**
     * Called when a request is rejected because the circuit for its service is open. The request was not sent.
     */
    void onRequestRejected(String serviceId, CircuitBreakerStats stats, Q request);

    /**
     * Called when a request would have been rejected because the circuit for its service is open, but is sent
     * anyway because the breaker is not enabled.
     */
    void onRequestTheoreticallyRejected(String serviceId, CircuitBreakerStats stats, Q request);

    /**
     * Called when the breaker is in the process of closing, i.e. some requests are allowed through while the
     * service is tested.
     */
    void onBreakerClosing(String serviceId, CircuitBreakerStats stats);
}
