package co.codecraft.servicebreaker;

/**
 * Thrown by {@link StatsStore} when its {@link StatsCache} fails. {@link CircuitBreaker} catches it and keeps
 * requests flowing; bookkeeping trouble is never a reason to block traffic.
 */
public class StatsStoreException extends RuntimeException {

    private final String serviceId;

    public StatsStoreException(String serviceId, String message, Throwable cause) {
        super(message, cause);
        this.serviceId = serviceId;
    }

    /**
     * @return the service whose stats could not be read or written.
     */
    public String getServiceId() {
        return serviceId;
    }
}
