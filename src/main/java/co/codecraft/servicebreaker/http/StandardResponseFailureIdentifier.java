package co.codecraft.servicebreaker.http;

import co.codecraft.servicebreaker.FailureIdentifier;
import co.codecraft.servicebreaker.OpenCircuitException;

import java.io.IOException;
import java.net.http.HttpResponse;

/**
 * The usual HTTP policy: a 5xx response is the service's fault, and so is any I/O failure while talking to
 * it (refused connections, resets, timeouts). 4xx responses are the caller's fault and count as successes.
 * Interruption and cancellation are not I/O failures and are not recorded. Neither is an
 * {@link OpenCircuitException} from a nested breaker, since that request never reached the service.
 */
public class StandardResponseFailureIdentifier implements FailureIdentifier<HttpResponse<?>> {

    @Override
    public boolean isResponseFailure(HttpResponse<?> response, String serviceId) {
        return response.statusCode() >= 500 && response.statusCode() <= 599;
    }

    @Override
    public boolean isExceptionFailure(Throwable e, String serviceId) {
        return e instanceof IOException && !(e instanceof OpenCircuitException);
    }
}
