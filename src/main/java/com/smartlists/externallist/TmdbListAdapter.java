package com.smartlists.externallist;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches TMDB user lists, charts and trending feeds through the TMDB v3 API.
 * <p>
 * Supported URLs:
 * <ul>
 *   <li>{@code https://www.themoviedb.org/list/{id}} - user list, paged until {@code total_pages}.</li>
 *   <li>{@code https://www.themoviedb.org/trending/{movie|tv|all}/{day|week}}</li>
 *   <li>{@code https://www.themoviedb.org/movie/{popular|top-rated|now-playing|upcoming}}</li>
 *   <li>{@code https://www.themoviedb.org/tv/{popular|top-rated|airing-today|on-the-air}}</li>
 *   <li>{@code https://www.themoviedb.org/movie} or {@code /tv} - the popular chart.</li>
 * </ul>
 * Chart and trending feeds are paged until {@code total_pages} or {@link #MAX_CHART_PAGES},
 * whichever comes first.
 * <p>
 * Only TMDB ids are emitted; the IMDb and TVDB families stay empty for this source.
 *
 * @author Smart Lists Team
 * @since 1.0
 */
public class TmdbListAdapter implements ListAdapterInterface {
    private static final Logger logger = LoggerFactory.getLogger(TmdbListAdapter.class);

    static final String API_BASE_URL = "https://api.themoviedb.org/3";
    static final int MAX_CHART_PAGES = 500;
    private static final String DOMAIN = "themoviedb.org";

    private static final Pattern USER_LIST = Pattern.compile("themoviedb\\.org/list/(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRENDING = Pattern.compile("themoviedb\\.org/trending/(movie|tv|all)/(day|week)", Pattern.CASE_INSENSITIVE);
    private static final Pattern MOVIE_CHART = Pattern.compile("themoviedb\\.org/movie/(popular|top-rated|now-playing|upcoming)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TV_CHART = Pattern.compile("themoviedb\\.org/tv/(popular|top-rated|airing-today|on-the-air)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_MEDIA = Pattern.compile("themoviedb\\.org/(movie|tv)/?(?:[?#].*)?$", Pattern.CASE_INSENSITIVE);

    private static final Map<String, String> MOVIE_CHARTS = Map.of(
        "popular", "popular",
        "top-rated", "top_rated",
        "now-playing", "now_playing",
        "upcoming", "upcoming"
    );
    private static final Map<String, String> TV_CHARTS = Map.of(
        "popular", "popular",
        "top-rated", "top_rated",
        "airing-today", "airing_today",
        "on-the-air", "on_the_air"
    );

    /**
     * API path a site URL maps to, and which paging strategy serves it.
     */
    record Route(String apiPath, boolean userList) {}

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final ExternalListConfig config;

    public TmdbListAdapter(HttpClient httpClient, ObjectMapper mapper, ExternalListConfig config) {
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
        String apiKey = config.tmdbApiKey();
        if (apiKey.isBlank()) {
            throw new ListFetchException("TMDB API key is not configured (TMDB_API_KEY)");
        }
        Route route = resolveRoute(url);
        if (route == null) {
            throw new ListFetchException("Invalid TMDB URL, supported formats: https://www.themoviedb.org/list/{id}, "
                + "https://www.themoviedb.org/movie/popular, https://www.themoviedb.org/tv/top-rated, "
                + "https://www.themoviedb.org/trending/movie/week: " + url);
        }
        logger.info("Fetching TMDB list: {} -> {}", url, route.apiPath());

        FetchResult result = new FetchResult();
        if (route.userList()) {
            fetchUserList(route.apiPath(), apiKey, result, token);
        } else {
            fetchChart(route.apiPath(), apiKey, result, token);
        }
        logger.info("Fetched {} items from TMDB {} (TMDB IDs: {})", result.totalItems(), url, result.tmdbIds().size());
        return result;
    }

    /**
     * Maps a themoviedb.org URL to an API path.
     * @param url Site URL
     * @return Route, or null if the URL is not a supported list or chart
     */
    static Route resolveRoute(String url) {
        Matcher m = USER_LIST.matcher(url);
        if (m.find()) {
            return new Route("/list/" + m.group(1), true);
        }
        m = TRENDING.matcher(url);
        if (m.find()) {
            return new Route("/trending/" + lower(m.group(1)) + "/" + lower(m.group(2)), false);
        }
        m = MOVIE_CHART.matcher(url);
        if (m.find()) {
            return new Route("/movie/" + MOVIE_CHARTS.get(lower(m.group(1))), false);
        }
        m = TV_CHART.matcher(url);
        if (m.find()) {
            return new Route("/tv/" + TV_CHARTS.get(lower(m.group(1))), false);
        }
        m = BARE_MEDIA.matcher(url);
        if (m.find()) {
            return new Route("/" + lower(m.group(1)) + "/popular", false);
        }
        return null;
    }

    // User lists report total_pages on every page; no cap applies.
    private void fetchUserList(String apiPath, String apiKey, FetchResult result, CancellationToken token) throws ListFetchException {
        int page = 1;
        int position = 0;
        while (true) {
            TmdbPageResponse response = fetchPage(apiPath, apiKey, page, position, result, token);
            if (response == null || response.items() == null || response.items().isEmpty()) {
                break;
            }
            position = addItems(response.items(), result, position);
            if (response.totalPages() == null || page >= response.totalPages()) {
                break;
            }
            page++;
        }
        result.setTotalItems(position);
    }

    private void fetchChart(String apiPath, String apiKey, FetchResult result, CancellationToken token) throws ListFetchException {
        int position = 0;
        for (int page = 1; page <= MAX_CHART_PAGES; page++) {
            TmdbPageResponse response = fetchPage(apiPath, apiKey, page, position, result, token);
            if (response == null || response.results() == null || response.results().isEmpty()) {
                break;
            }
            position = addItems(response.results(), result, position);
            if (response.totalPages() != null && page >= response.totalPages()) {
                break;
            }
            if (page == MAX_CHART_PAGES) {
                logger.warn("TMDB feed {} reached the {} page limit, stopping", apiPath, MAX_CHART_PAGES);
            }
        }
        result.setTotalItems(position);
    }

    /**
     * @return parsed page, or null when paging should stop and keep what was read
     */
    private TmdbPageResponse fetchPage(String apiPath, String apiKey, int page, int fetched, FetchResult result,
                                       CancellationToken token) throws ListFetchException {
        String requestUrl = API_BASE_URL + apiPath + "?api_key=" + Utils.encode(apiKey) + "&page=" + page;
        HttpRequest request = HttpRequest.newBuilder(URI.create(requestUrl))
            .timeout(config.requestTimeout())
            .header("Accept", "application/json")
            .GET()
            .build();
        try {
            HttpResponse<String> response = Utils.send(httpClient, request, token);
            if (!Utils.isSuccess(response)) {
                stopPaging(result, fetched, "TMDB API returned " + response.statusCode() + " for " + apiPath + " page " + page, null);
                return null;
            }
            return mapper.readValue(response.body(), TmdbPageResponse.class);
        } catch (IOException e) {
            stopPaging(result, fetched, "Error reading TMDB " + apiPath + " page " + page + ": " + e.getMessage(), e);
            return null;
        }
    }

    private static int addItems(List<TmdbPageResponse.Item> items, FetchResult result, int position) {
        for (TmdbPageResponse.Item item : items) {
            if (item != null) {
                result.addTmdbId(item.id(), position);
            }
            position++;
        }
        return position;
    }

    private static void stopPaging(FetchResult result, int fetched, String message, Throwable cause) throws ListFetchException {
        if (fetched == 0) {
            throw new ListFetchException(message, cause);
        }
        logger.warn("{}; keeping {} items fetched so far", message, fetched);
        result.markTruncated(message);
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
