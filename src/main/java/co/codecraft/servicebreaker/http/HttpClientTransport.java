package co.codecraft.servicebreaker.http;

import co.codecraft.servicebreaker.Transport;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Sends requests with a JDK {@link HttpClient}, reading each body with the same handler.
 *
 * <pre>
 *    Transport&lt;HttpRequest, HttpResponse&lt;String&gt;&gt; guarded = new CircuitBreakerInterceptor&lt;...&gt;(
 *            breaker, new EndpointServiceIdentifier(), new StandardResponseFailureIdentifier(),
 *            new HttpClientTransport&lt;String&gt;(client, HttpResponse.BodyHandlers.ofString()));
 * </pre>
 *
 * @param <T>  The type of response body.
 */
public class HttpClientTransport<T> implements Transport<HttpRequest, HttpResponse<T>> {

    private final HttpClient client;
    private final HttpResponse.BodyHandler<T> bodyHandler;

    public HttpClientTransport(HttpClient client, HttpResponse.BodyHandler<T> bodyHandler) {
        if (client == null) {
            throw new IllegalArgumentException("Client cannot be null.");
        }
        if (bodyHandler == null) {
            throw new IllegalArgumentException("Body handler cannot be null.");
        }
        this.client = client;
        this.bodyHandler = bodyHandler;
    }

    @Override
    public HttpResponse<T> call(HttpRequest request) throws IOException, InterruptedException {
        return client.send(request, bodyHandler);
    }
}
