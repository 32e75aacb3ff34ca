package com.smartlists.externallist;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches list items from the MDBList API for URLs like {@code https://mdblist.com/lists/{user}/{list}}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Pages through {@code /lists/{user}/{list}/items} with a fixed page size, advancing the offset
 *       until a page returns fewer items than the page size.</li>
 *   <li>Parses each page as a {@code {movies, shows}} wrapper first and falls back to a bare array.</li>
 *   <li>Takes the IMDb and TVDB ids from the top-level fields when present, otherwise from the nested
 *       {@code ids} object; the TMDB id only exists in {@code ids}.</li>
 *   <li>Advances the position for every item, including items without any usable id.</li>
 * </ul>
 * <p>
 * Error Handling:
 * <ul>
 *   <li>A missing API key or an unrecognized URL raises {@link ListFetchException}.</li>
 *   <li>A failed or unparsable page keeps the items read so far; on the first page it raises
 *       {@link ListFetchException}.</li>
 * </ul>
 *
 * @author Smart Lists Team
 * @since 1.0
 */
public class MdbListAdapter implements ListAdapterInterface {
    private static final Logger logger = LoggerFactory.getLogger(MdbListAdapter.class);

    static final String API_BASE_URL = "https://api.mdblist.com";
    static final int PAGE_SIZE = 1000;
    private static final String DOMAIN = "mdblist.com";
    private static final Pattern LIST_URL = Pattern.compile("mdblist\\.com/lists/([^/]+)/([^/?#]+)", Pattern.CASE_INSENSITIVE);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final ExternalListConfig config;

    public MdbListAdapter(HttpClient httpClient, ObjectMapper mapper, ExternalListConfig config) {
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
        String apiKey = config.mdbListApiKey();
        if (apiKey.isBlank()) {
            throw new ListFetchException("MDBList API key is not configured (MDBLIST_API_KEY)");
        }
        Matcher m = LIST_URL.matcher(url);
        if (!m.find()) {
            throw new ListFetchException("Invalid MDBList URL, expected https://mdblist.com/lists/{username}/{listname}: " + url);
        }
        String username = m.group(1);
        String listname = m.group(2);
        logger.info("Fetching external list from MDBList: {}/{}", username, listname);

        FetchResult result = new FetchResult();
        int offset = 0;
        int position = 0;
        int totalFetched = 0;
        while (true) {
            String apiUrl = String.format("%s/lists/%s/%s/items?apikey=%s&limit=%d&offset=%d",
                API_BASE_URL, Utils.encode(username), Utils.encode(listname), Utils.encode(apiKey), PAGE_SIZE, offset);
            HttpRequest request = HttpRequest.newBuilder(URI.create(apiUrl))
                .timeout(config.requestTimeout())
                .header("Accept", "application/json")
                .GET()
                .build();

            List<MdbListResponse.Item> items;
            try {
                HttpResponse<String> response = Utils.send(httpClient, request, token);
                if (!Utils.isSuccess(response)) {
                    stopPaging(result, totalFetched, "MDBList API returned " + response.statusCode() + " for list " + username + "/" + listname, null);
                    break;
                }
                items = parseItems(response.body());
            } catch (IOException e) {
                // JsonProcessingException is an IOException, so malformed pages land here too
                stopPaging(result, totalFetched, "Error reading MDBList list " + username + "/" + listname + ": " + e.getMessage(), e);
                break;
            }

            for (MdbListResponse.Item item : items) {
                addItemIds(item, result, position);
                position++;
            }
            totalFetched += items.size();

            if (items.size() < PAGE_SIZE) {
                break;
            }
            offset += PAGE_SIZE;
        }

        result.setTotalItems(totalFetched);
        logger.info("Fetched {} items from MDBList {}/{} (IMDb: {}, TMDB: {}, TVDB: {})",
            totalFetched, username, listname, result.imdbIds().size(), result.tmdbIds().size(), result.tvdbIds().size());
        return result;
    }

    /**
     * Parses one page, trying the wrapper object first and the bare array second.
     * Movies are returned before shows.
     */
    List<MdbListResponse.Item> parseItems(String json) throws JsonProcessingException {
        try {
            MdbListResponse wrapper = mapper.readValue(json, MdbListResponse.class);
            List<MdbListResponse.Item> items = new ArrayList<>();
            if (wrapper != null && wrapper.movies() != null) items.addAll(wrapper.movies());
            if (wrapper != null && wrapper.shows() != null) items.addAll(wrapper.shows());
            return items;
        } catch (JsonProcessingException wrapperFailure) {
            logger.debug("MDBList page is not a wrapper object, trying bare array: {}", wrapperFailure.getOriginalMessage());
            MdbListResponse.Item[] items = mapper.readValue(json, MdbListResponse.Item[].class);
            return items == null ? List.of() : Arrays.asList(items);
        }
    }

    private static void addItemIds(MdbListResponse.Item item, FetchResult result, int position) {
        if (item == null) {
            return;
        }
        MdbListResponse.Ids ids = item.ids();
        String imdbId = item.imdbId() != null ? item.imdbId() : (ids != null ? ids.imdb() : null);
        result.addImdbId(imdbId, position);
        if (ids != null) {
            result.addTmdbId(ids.tmdb(), position);
        }
        Integer tvdbId = item.tvdbId() != null ? item.tvdbId() : (ids != null ? ids.tvdb() : null);
        result.addTvdbId(tvdbId, position);
    }

    private static void stopPaging(FetchResult result, int totalFetched, String message, Throwable cause) throws ListFetchException {
        if (totalFetched == 0) {
            throw new ListFetchException(message, cause);
        }
        logger.warn("{}; keeping {} items fetched so far", message, totalFetched);
        result.markTruncated(message);
    }
}
