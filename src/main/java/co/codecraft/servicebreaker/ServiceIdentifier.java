package co.codecraft.servicebreaker;

/**
 * Names the logical service behind a request. Requests that map to the same identifier share one set of
 * stats, and therefore one circuit. See the <code>http</code> package for host-based and endpoint-based
 * implementations.
 *
 * @param <Q>  The type of request.
 */
public interface ServiceIdentifier<Q> {

    /**
     * @return a stable, non-null identifier for the service that <code>request</code> is aimed at.
     */
    String getServiceIdentifier(Q request);
}
