package com.smartlists.externallist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrapes IMDb ids from public IMDb list and chart pages, e.g.
 * {@code https://www.imdb.com/list/ls123456789/} or {@code https://www.imdb.com/chart/top/}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Issues exactly one request; IMDb serves a truncated page to non-browser clients, so the
 *       request carries a desktop browser User-Agent and an Accept-Language header.</li>
 *   <li>Scans the raw HTML for {@code /title/tt.../} anchors. The first anchor of an id sets its
 *       rank; repeats (poster and title links of the same entry) are ignored.</li>
 * </ul>
 * <p>
 * A non-success status always raises {@link ListFetchException}: an empty id set from a broken page
 * load must not look like an empty list.
 *
 * @author Smart Lists Team
 * @since 1.0
 */
public class ImdbListAdapter implements ListAdapterInterface {
    private static final Logger logger = LoggerFactory.getLogger(ImdbListAdapter.class);

    static final String BROWSER_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";
    static final String ACCEPT_LANGUAGE = "en-US,en;q=0.9";
    private static final String DOMAIN = "imdb.com";
    private static final Pattern LIST_URL = Pattern.compile("imdb\\.com/(list/ls\\d+|chart/\\w+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE_ID = Pattern.compile("/title/(tt\\d{7,})/");

    private final HttpClient httpClient;
    private final ExternalListConfig config;

    public ImdbListAdapter(HttpClient httpClient, ExternalListConfig config) {
        this.httpClient = httpClient;
        this.config = config;
    }

    @Override
    public boolean canHandle(String url) {
        return Utils.matchesHost(url, DOMAIN);
    }

    @Override
    public FetchResult fetch(String url, CancellationToken token) throws ListFetchException {
        if (!LIST_URL.matcher(url).find()) {
            throw new ListFetchException("Invalid IMDb URL, expected https://www.imdb.com/list/ls123456789/ or https://www.imdb.com/chart/top/: " + url);
        }
        String listUrl = withTrailingSlash(url.trim());
        logger.info("Fetching IMDb list: {}", listUrl);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(listUrl))
                .timeout(config.requestTimeout())
                .header("User-Agent", BROWSER_USER_AGENT)
                .header("Accept-Language", ACCEPT_LANGUAGE)
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            throw new ListFetchException("Invalid IMDb URL: " + url, e);
        }

        HttpResponse<String> response;
        try {
            response = Utils.send(httpClient, request, token);
        } catch (IOException e) {
            throw new ListFetchException("Error fetching IMDb list " + listUrl + ": " + e.getMessage(), e);
        }
        if (!Utils.isSuccess(response)) {
            throw new ListFetchException("IMDb returned " + response.statusCode() + " for " + listUrl);
        }

        FetchResult result = extractIds(response.body());
        logger.info("Fetched {} items from IMDb list {}", result.totalItems(), listUrl);
        return result;
    }

    /**
     * Extracts title ids in document order.
     * <p>
     * Positions are dense ranks over distinct ids: a title linked several times on the page (poster
     * and title anchors) takes the rank of its first link, and the next new title gets the next rank.
     * Positions are therefore 0..n-1 with no gaps, and {@code totalItems} equals the number of distinct ids.
     */
    static FetchResult extractIds(String html) {
        FetchResult result = new FetchResult();
        if (html == null) {
            return result;
        }
        Matcher matcher = TITLE_ID.matcher(html);
        while (matcher.find()) {
            String id = matcher.group(1);
            if (!result.imdbIds().containsKey(id)) {
                result.addImdbId(id, result.imdbIds().size());
            }
        }
        result.setTotalItems(result.imdbIds().size());
        return result;
    }

    private static String withTrailingSlash(String url) {
        int end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') {
            end--;
        }
        return url.substring(0, end) + "/";
    }
}
