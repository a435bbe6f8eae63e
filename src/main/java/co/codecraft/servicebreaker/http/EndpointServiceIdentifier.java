package co.codecraft.servicebreaker.http;

import co.codecraft.servicebreaker.ServiceIdentifier;

import java.net.URI;
import java.net.http.HttpRequest;

/**
 * Groups requests by method and endpoint, e.g. <code>GET https://api.example.com/users</code>. The query string,
 * port and any leading or trailing slashes on the path are ignored, so <code>/users/</code> and
 * <code>/users?page=2</code> land in the same circuit.
 */
public class EndpointServiceIdentifier implements ServiceIdentifier<HttpRequest> {

    @Override
    public String getServiceIdentifier(HttpRequest request) {
        URI uri = request.uri();
        return request.method() + " " + uri.getScheme() + "://" + trimTrailing(uri.getHost()) + "/"
                + trimBoth(uri.getPath());
    }

    private static String trimTrailing(String s) {
        if (s == null) {
            return "";
        }
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '/') {
            --end;
        }
        return s.substring(0, end);
    }

    private static String trimBoth(String s) {
        String trimmed = trimTrailing(s);
        int start = 0;
        while (start < trimmed.length() && trimmed.charAt(start) == '/') {
            ++start;
        }
        return trimmed.substring(start);
    }
}
