package com.smartlists.externallist;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches Trakt user lists, watchlists and charts through the Trakt v2 API.
 * <p>
 * Supported URLs:
 * <ul>
 *   <li>{@code https://trakt.tv/users/{user}/lists/{list}}</li>
 *   <li>{@code https://trakt.tv/users/{user}/watchlist}</li>
 *   <li>{@code https://trakt.tv/{movies|shows}/{trending|popular|watched|played|collected|anticipated}}
 *       and {@code https://trakt.tv/movies/boxoffice}</li>
 * </ul>
 * Paging follows the {@code X-Pagination-Page-Count} response header; when the header is missing a
 * short page ends the list. Ids are read from the nested {@code movie} or {@code show} object before
 * the item's own {@code ids}.
 *
 * @author Smart Lists Team
 * @since 1.0
 */
public class TraktListAdapter implements ListAdapterInterface {
    private static final Logger logger = LoggerFactory.getLogger(TraktListAdapter.class);

    static final String API_BASE_URL = "https://api.trakt.tv";
    static final int PAGE_SIZE = 100;
    static final String PAGE_COUNT_HEADER = "X-Pagination-Page-Count";
    static final String USER_AGENT = "SmartListsExternalLists/1.0";
    private static final String DOMAIN = "trakt.tv";

    private static final Pattern USER_LIST = Pattern.compile("trakt\\.tv/users/([^/]+)/lists/([^/?#]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern WATCHLIST = Pattern.compile("trakt\\.tv/users/([^/]+)/watchlist", Pattern.CASE_INSENSITIVE);
    private static final Pattern CHART = Pattern.compile(
        "trakt\\.tv/(movies|shows)/(trending|popular|watched|played|collected|anticipated|boxoffice)", Pattern.CASE_INSENSITIVE);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final ExternalListConfig config;

    public TraktListAdapter(HttpClient httpClient, ObjectMapper mapper, ExternalListConfig config) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.config = config;
    }

    @Override
    public boolean canHandle(String url) {
        return Utils.matchesHost(url, DOMAIN);
    }

    @Override
    public FetchResult fetch(String url, CancellationToken token) throws ListFetchException {
        String clientId = config.traktClientId();
        if (clientId.isBlank()) {
            throw new ListFetchException("Trakt client ID is not configured (TRAKT_CLIENT_ID)");
        }
        String apiPath = resolveApiPath(url);
        if (apiPath == null) {
            throw new ListFetchException("Invalid Trakt URL, supported formats: https://trakt.tv/users/{user}/lists/{list}, "
                + "https://trakt.tv/users/{user}/watchlist, https://trakt.tv/movies/trending, https://trakt.tv/shows/popular: " + url);
        }
        logger.info("Fetching Trakt list: {} -> {}", url, apiPath);

        FetchResult result = new FetchResult();
        int page = 1;
        int position = 0;
        while (true) {
            String requestUrl = API_BASE_URL + apiPath + "?page=" + page + "&limit=" + PAGE_SIZE + "&extended=full";
            HttpRequest request = HttpRequest.newBuilder(URI.create(requestUrl))
                .timeout(config.requestTimeout())
                .header("Accept", "application/json")
                .header("trakt-api-version", "2")
                .header("trakt-api-key", clientId)
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();

            HttpResponse<String> response;
            TraktItem[] items;
            try {
                response = Utils.send(httpClient, request, token);
                if (!Utils.isSuccess(response)) {
                    stopPaging(result, position, "Trakt API returned " + response.statusCode() + " for " + apiPath + " page " + page, null);
                    break;
                }
                items = mapper.readValue(response.body(), TraktItem[].class);
            } catch (IOException e) {
                stopPaging(result, position, "Error reading Trakt " + apiPath + " page " + page + ": " + e.getMessage(), e);
                break;
            }
            if (items == null || items.length == 0) {
                break;
            }

            for (TraktItem item : items) {
                addItemIds(item, result, position);
                position++;
            }

            OptionalInt pageCount = pageCount(response);
            if (pageCount.isPresent()) {
                if (page >= pageCount.getAsInt()) {
                    break;
                }
            } else if (items.length < PAGE_SIZE) {
                break;
            }
            page++;
        }

        result.setTotalItems(position);
        logger.info("Fetched {} items from Trakt {} (IMDb: {}, TMDB: {}, TVDB: {})",
            position, url, result.imdbIds().size(), result.tmdbIds().size(), result.tvdbIds().size());
        return result;
    }

    /**
     * Maps a trakt.tv URL to an API path.
     * @param url Site URL
     * @return API path, or null if the URL is not a supported list or chart
     */
    static String resolveApiPath(String url) {
        Matcher m = USER_LIST.matcher(url);
        if (m.find()) {
            return "/users/" + Utils.encode(m.group(1)) + "/lists/" + Utils.encode(m.group(2)) + "/items";
        }
        m = WATCHLIST.matcher(url);
        if (m.find()) {
            return "/users/" + Utils.encode(m.group(1)) + "/watchlist";
        }
        m = CHART.matcher(url);
        if (m.find()) {
            String mediaType = m.group(1).toLowerCase(Locale.ROOT);
            String chart = m.group(2).toLowerCase(Locale.ROOT);
            switch (chart) {
                case "trending":
                case "popular":
                case "anticipated":
                    return "/" + mediaType + "/" + chart;
                case "watched":
                case "played":
                case "collected":
                    return "/" + mediaType + "/" + chart + "/weekly";
                case "boxoffice":
                    return mediaType.equals("movies") ? "/movies/boxoffice" : null;
                default:
                    return null;
            }
        }
        return null;
    }

    private static OptionalInt pageCount(HttpResponse<String> response) {
        return response.headers().firstValue(PAGE_COUNT_HEADER)
            .map(String::trim)
            .filter(v -> v.matches("\\d{1,9}"))
            .map(v -> OptionalInt.of(Integer.parseInt(v)))
            .orElse(OptionalInt.empty());
    }

    private static void addItemIds(TraktItem item, FetchResult result, int position) {
        if (item == null) {
            return;
        }
        TraktItem.Ids ids = item.resolveIds();
        if (ids == null) {
            return;
        }
        result.addImdbId(ids.imdb(), position);
        result.addTmdbId(ids.tmdb(), position);
        result.addTvdbId(ids.tvdb(), position);
    }

    private static void stopPaging(FetchResult result, int fetched, String message, Throwable cause) throws ListFetchException {
        if (fetched == 0) {
            throw new ListFetchException(message, cause);
        }
        logger.warn("{}; keeping {} items fetched so far", message, fetched);
        result.markTruncated(message);
    }
}
