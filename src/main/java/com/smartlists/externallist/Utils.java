package com.smartlists.externallist;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.CancellationException;

/**
 * Helper methods shared by the list adapters for URL matching and HTTP exchange.
 *
 * @author Smart Lists Team
 * @since 1.0
 */
public final class Utils {
    private Utils() {}

    /**
     * Checks that a URL is absolute http(s) and that its host is {@code domain} or a subdomain of it.
     * @param url Candidate URL, may be null
     * @param domain Bare domain such as "trakt.tv"
     * @return true on a match, false for blank or unparsable input
     */
    public static boolean matchesHost(String url, String domain) {
        if (url == null || url.isBlank()) {
            return false;
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return false;
        }
        String scheme = uri.getScheme();
        String host = uri.getHost();
        if (scheme == null || host == null) {
            return false;
        }
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return false;
        }
        host = host.toLowerCase(Locale.ROOT);
        String target = domain.toLowerCase(Locale.ROOT);
        return host.equals(target) || host.endsWith("." + target);
    }

    /**
     * Percent-encodes a path segment or query value.
     */
    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public static boolean isSuccess(HttpResponse<?> response) {
        return response.statusCode() >= 200 && response.statusCode() < 300;
    }

    /**
     * Sends a request after checking the cancellation token. An interrupt while waiting is
     * reported as cancellation with the thread's interrupt flag restored.
     * @param client HTTP client
     * @param request Request to send
     * @param token Batch cancellation signal
     * @return Response with the body as a string
     * @throws IOException on transport failure or timeout
     */
    public static HttpResponse<String> send(HttpClient client, HttpRequest request, CancellationToken token) throws IOException {
        token.throwIfCancellationRequested();
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while fetching " + request.uri());
            cancelled.initCause(e);
            throw cancelled;
        }
    }
}
