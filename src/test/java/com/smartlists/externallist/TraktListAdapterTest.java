package com.smartlists.externallist;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.net.http.HttpRequest;
import java.util.StringJoiner;

import static org.junit.jupiter.api.Assertions.*;

public class TraktListAdapterTest {
    private static final ExternalListConfig CONFIG = new ExternalListConfig("", "", "trakt-client");
    private final ObjectMapper mapper = ListAdapters.newObjectMapper();

    private TraktListAdapter adapter(StubHttp http) {
        return new TraktListAdapter(http.client(), mapper, CONFIG);
    }

    private static String movies(int firstTmdb, int count) {
        StringJoiner items = new StringJoiner(",", "[", "]");
        for (int i = 0; i < count; i++) {
            int id = firstTmdb + i;
            items.add("{\"rank\":" + (i + 1) + ",\"movie\":{\"title\":\"M" + id + "\",\"ids\":{\"trakt\":" + id
                + ",\"imdb\":\"tt" + (2000000 + id) + "\",\"tmdb\":" + id + "}}}");
        }
        return items.toString();
    }

    @Test
    void testRouteResolution() {
        assertEquals("/users/jdoe/lists/weekend-picks/items",
            TraktListAdapter.resolveApiPath("https://trakt.tv/users/jdoe/lists/weekend-picks?sort=rank,asc"));
        assertEquals("/users/jdoe/watchlist", TraktListAdapter.resolveApiPath("https://trakt.tv/users/jdoe/watchlist"));
        assertEquals("/movies/trending", TraktListAdapter.resolveApiPath("https://trakt.tv/movies/trending"));
        assertEquals("/shows/popular", TraktListAdapter.resolveApiPath("https://trakt.tv/shows/popular"));
        assertEquals("/shows/watched/weekly", TraktListAdapter.resolveApiPath("https://trakt.tv/shows/watched"));
        assertEquals("/movies/collected/weekly", TraktListAdapter.resolveApiPath("https://trakt.tv/Movies/Collected"));
        assertEquals("/movies/anticipated", TraktListAdapter.resolveApiPath("https://trakt.tv/movies/anticipated"));
        assertEquals("/movies/boxoffice", TraktListAdapter.resolveApiPath("https://trakt.tv/movies/boxoffice"));
        assertNull(TraktListAdapter.resolveApiPath("https://trakt.tv/shows/boxoffice"));
        assertNull(TraktListAdapter.resolveApiPath("https://trakt.tv/calendars/my/shows"));
    }

    @Test
    void testPageCountHeaderDrivesPagination() throws Exception {
        StubHttp http = new StubHttp(request -> {
            int pageNo = StubHttp.intQuery(request, "page");
            // full pages are never short here, so only the header can stop the loop
            return StubHttp.Reply.ok(movies(pageNo * 1000, TraktListAdapter.PAGE_SIZE))
                .withHeader("X-Pagination-Page-Count", "3");
        });

        FetchResult result = adapter(http).fetch("https://trakt.tv/users/jdoe/lists/big", CancellationToken.none());

        assertEquals(3, http.requestCount());
        assertEquals(300, result.totalItems());
        assertEquals(100, result.tmdbIds().get("2000"));
        assertEquals(100, result.imdbIds().get("tt2002000"));
    }

    @Test
    void testShortPageStopsWhenHeaderMissing() throws Exception {
        StubHttp http = new StubHttp(request -> StubHttp.intQuery(request, "page") == 1
            ? StubHttp.Reply.ok(movies(1, 100))
            : StubHttp.Reply.ok(movies(101, 40)));

        FetchResult result = adapter(http).fetch("https://trakt.tv/users/jdoe/watchlist", CancellationToken.none());

        assertEquals(2, http.requestCount());
        assertEquals(140, result.totalItems());
    }

    @Test
    void testRequestHeadersAndQuery() throws Exception {
        StubHttp http = new StubHttp(r -> StubHttp.Reply.ok("[]"));

        adapter(http).fetch("https://trakt.tv/movies/watched", CancellationToken.none());

        HttpRequest request = http.requests().get(0);
        assertEquals("api.trakt.tv", request.uri().getHost());
        assertEquals("/movies/watched/weekly", request.uri().getPath());
        assertEquals("1", StubHttp.query(request, "page"));
        assertEquals("100", StubHttp.query(request, "limit"));
        assertEquals("full", StubHttp.query(request, "extended"));
        assertEquals("2", request.headers().firstValue("trakt-api-version").orElse(""));
        assertEquals("trakt-client", request.headers().firstValue("trakt-api-key").orElse(""));
        assertEquals(TraktListAdapter.USER_AGENT, request.headers().firstValue("User-Agent").orElse(""));
    }

    @Test
    void testNestedIdsCheckedBeforeDirectIds() throws Exception {
        String body = "["
            + "{\"show\":{\"title\":\"S\",\"ids\":{\"tvdb\":81189,\"imdb\":\"tt0903747\",\"tmdb\":1396}}},"
            + "{\"title\":\"Direct\",\"ids\":{\"imdb\":\"tt0133093\",\"tmdb\":603}},"
            + "{\"watchers\":12},"
            + "{\"movie\":{\"ids\":{\"tmdb\":27205}},\"ids\":{\"tmdb\":999}}"
            + "]";
        StubHttp http = new StubHttp(r -> StubHttp.Reply.ok(body));

        FetchResult result = adapter(http).fetch("https://trakt.tv/shows/trending", CancellationToken.none());

        assertEquals(4, result.totalItems());
        assertEquals(0, result.tvdbIds().get("81189"));
        assertEquals(1, result.imdbIds().get("tt0133093"));
        assertEquals(3, result.tmdbIds().get("27205"));
        assertFalse(result.tmdbIds().containsKey("999"));
    }

    @Test
    void testFailuresAndMissingClientId() throws Exception {
        StubHttp unauthorized = new StubHttp(r -> StubHttp.Reply.status(403));
        assertThrows(ListFetchException.class,
            () -> adapter(unauthorized).fetch("https://trakt.tv/movies/popular", CancellationToken.none()));

        StubHttp flaky = new StubHttp(request -> StubHttp.intQuery(request, "page") == 1
            ? StubHttp.Reply.ok(movies(1, 100))
            : StubHttp.Reply.ok("not json"));
        FetchResult partial = adapter(flaky).fetch("https://trakt.tv/movies/popular", CancellationToken.none());
        assertEquals(100, partial.totalItems());
        assertTrue(partial.isTruncated());

        TraktListAdapter noClient = new TraktListAdapter(unauthorized.client(), mapper, new ExternalListConfig("a", "b", ""));
        assertThrows(ListFetchException.class, () -> noClient.fetch("https://trakt.tv/movies/popular", CancellationToken.none()));

        assertThrows(ListFetchException.class,
            () -> adapter(unauthorized).fetch("https://trakt.tv/calendars/my/shows", CancellationToken.none()));
        assertEquals(1, unauthorized.requestCount());
    }
}
