package co.codecraft.servicebreaker;

import java.io.IOException;

/**
 * Thrown instead of sending a request when the circuit for its service is open and the breaker is enabled.
 * To the caller this is just another failed I/O call, but it is a fast failure: retrying against the same
 * breaker is pointless until the service's status changes.
 */
public class OpenCircuitException extends IOException {

    private final String serviceId;
    private final transient Object request;

    public OpenCircuitException(String serviceId, Object request) {
        super(String.format("The request %s was rejected due to an open circuit for service `%s`.",
                request, serviceId));
        this.serviceId = serviceId;
        this.request = request;
    }

    /**
     * @return the service whose circuit is open.
     */
    public String getServiceId() {
        return serviceId;
    }

    /**
     * @return the request that was not sent. May be null if the exception was deserialized.
     */
    public Object getRequest() {
        return request;
    }
}
