package co.codecraft.servicebreaker;

import java.io.IOException;

/**
 * <p>Runs one request through a {@link CircuitBreaker}: identify the service, ask the breaker, send the request
 * with the wrapped {@link Transport}, and report the outcome. The interceptor is itself a Transport, so
 * it can be handed to code that expects one, or wrapped by another breaker with a different policy.</p>
 *
 * <ul>
 *     <li>If the circuit is open (and the breaker enabled), {@link OpenCircuitException} is thrown and the
 *     wrapped transport is never called.</li>
 *     <li>A response is always recorded, as a failure or a success according to the {@link FailureIdentifier}.</li>
 *     <li>An exception is recorded as a failure only if the FailureIdentifier says so. Either way it is
 *     rethrown unchanged.</li>
 * </ul>
 *
 * <p>Everything happens on the calling thread. Listeners have been notified of any transition by the time
 * this method returns or throws.</p>
 *
 * @param <Q>  The type of request.
 * @param <R>  The type of response.
 */
public class CircuitBreakerInterceptor<Q, R> implements Transport<Q, R> {

    private final CircuitBreaker<Q> breaker;
    private final ServiceIdentifier<? super Q> serviceIdentifier;
    private final FailureIdentifier<? super R> failureIdentifier;
    private final Transport<Q, R> transport;

    /**
     * @param breaker  May not be null.
     * @param serviceIdentifier  May not be null.
     * @param failureIdentifier  May not be null.
     * @param transport  Does the real work. May not be null.
     */
    public CircuitBreakerInterceptor(CircuitBreaker<Q> breaker, ServiceIdentifier<? super Q> serviceIdentifier,
                                     FailureIdentifier<? super R> failureIdentifier, Transport<Q, R> transport) {
        if (breaker == null) {
            throw new IllegalArgumentException("Breaker cannot be null.");
        }
        if (serviceIdentifier == null) {
            throw new IllegalArgumentException("Service identifier cannot be null; requests could not be grouped.");
        }
        if (failureIdentifier == null) {
            throw new IllegalArgumentException("Failure identifier cannot be null; outcomes could not be judged.");
        }
        if (transport == null) {
            throw new IllegalArgumentException("Transport cannot be null; there would be nothing to protect.");
        }
        this.breaker = breaker;
        this.serviceIdentifier = serviceIdentifier;
        this.failureIdentifier = failureIdentifier;
        this.transport = transport;
    }

    @Override
    public R call(Q request) throws IOException, InterruptedException {
        String serviceId = serviceIdentifier.getServiceIdentifier(request);
        CircuitDecision decision = breaker.decide(serviceId, request);
        R response;
        try {
            response = transport.call(request);
        } catch (Exception e) {
            if (failureIdentifier.isExceptionFailure(e, serviceId)) {
                breaker.recordOutcome(serviceId, decision, true);
            }
            throw e;
        }
        breaker.recordOutcome(serviceId, decision, failureIdentifier.isResponseFailure(response, serviceId));
        return response;
    }

    public CircuitBreaker<Q> getBreaker() {
        return breaker;
    }
}
