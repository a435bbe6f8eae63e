package co.codecraft.servicebreaker;

/**
 * Decides which outcomes count against a service. Anything this says is not a failure is either counted as
 * a success (responses) or not counted at all (exceptions).
 *
 * @param <R>  The type of response.
 */
public interface FailureIdentifier<R> {

    /**
     * @return true if <code>response</code> means the service failed.
     */
    boolean isResponseFailure(R response, String serviceId);

    /**
     * @return true if <code>e</code>, thrown while calling the service, means the service failed. Return false
     *     for errors that are the caller's own (cancellation, interruption, bugs); those are not recorded.
     */
    boolean isExceptionFailure(Throwable e, String serviceId);
}
