package co.codecraft.servicebreaker;

import java.io.IOException;

/**
 * Sends a request and waits for its response. This is the unit of work a breaker protects.
 *
 * @param <Q>  The type of request.
 * @param <R>  The type of response.
 */
public interface Transport<Q, R> {

    R call(Q request) throws IOException, InterruptedException;
}
