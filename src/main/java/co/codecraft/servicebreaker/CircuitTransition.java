package co.codecraft.servicebreaker;

/**
 * A change in the status of one service's breaker, as observed right after recording an outcome. Built only
 * to drive listener notification; nothing stores it.
 */
public final class CircuitTransition {

    public final String serviceId;
    public final CircuitStatus previousStatus;
    public final CircuitStatus newStatus;

    /** The stats that produced {@link #newStatus}. */
    public final CircuitBreakerStats stats;

    public CircuitTransition(String serviceId, CircuitStatus previousStatus, CircuitStatus newStatus,
                             CircuitBreakerStats stats) {
        this.serviceId = serviceId;
        this.previousStatus = previousStatus;
        this.newStatus = newStatus;
        this.stats = stats;
    }

    /**
     * Deliver this transition to the listener callback that matches {@link #newStatus}.
     *
     * @param enabled  Whether the breaker is enabled; decides between a real and a theoretical trip.
     */
    <Q> void deliverTo(CircuitBreakerListener<Q> listener, boolean enabled) {
        switch (newStatus) {
            case CLOSED:
                listener.onBreakerReset(serviceId, stats, previousStatus);
                break;
            case OPEN:
                if (enabled) {
                    listener.onBreakerTripped(serviceId, stats, previousStatus);
                } else {
                    listener.onBreakerTheoreticallyTripped(serviceId, stats, previousStatus);
                }
                break;
            case CLOSING:
                listener.onBreakerClosing(serviceId, stats);
                break;
            default:
                throw new IllegalArgumentException(String.format("Unrecognized status %s.", newStatus));
        }
    }

    @Override
    public String toString() {
        return serviceId + ": " + previousStatus + " --> " + newStatus + " (" + stats + ")";
    }
}
