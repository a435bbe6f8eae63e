package co.codecraft.servicebreaker;

/**
 * What {@link CircuitBreaker#decide(String, Object)} saw when it let a request through: the service's status
 * and the config that status was judged under. Hand it back to
 * {@link CircuitBreaker#recordOutcome(String, CircuitDecision, boolean)} so the outcome is judged the same way.
 */
public final class CircuitDecision {

    public final CircuitStatus status;
    public final CircuitBreakerConfig config;

    public CircuitDecision(CircuitStatus status, CircuitBreakerConfig config) {
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null.");
        }
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null.");
        }
        this.status = status;
        this.config = config;
    }

    @Override
    public String toString() {
        return status + " under [" + config + "]";
    }
}
