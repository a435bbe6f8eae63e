package co.codecraft.servicebreaker.http;

import co.codecraft.servicebreaker.ServiceIdentifier;

import java.net.http.HttpRequest;

/**
 * Groups requests by host: every endpoint on <code>api.example.com</code> shares one circuit.
 */
public class HostServiceIdentifier implements ServiceIdentifier<HttpRequest> {

    @Override
    public String getServiceIdentifier(HttpRequest request) {
        return request.uri().getHost();
    }
}
