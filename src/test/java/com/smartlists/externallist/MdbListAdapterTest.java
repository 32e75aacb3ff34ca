package com.smartlists.externallist;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

public class MdbListAdapterTest {
    private static final String LIST_URL = "https://mdblist.com/lists/jdoe/top-horror";
    private static final ExternalListConfig CONFIG = new ExternalListConfig("mdb-key", "", "");
    private final ObjectMapper mapper = ListAdapters.newObjectMapper();

    private MdbListAdapter adapter(StubHttp http, ExternalListConfig config) {
        return new MdbListAdapter(http.client(), mapper, config);
    }

    private static String bareArray(int startId, int count) {
        StringJoiner items = new StringJoiner(",", "[", "]");
        for (int i = 0; i < count; i++) {
            int id = startId + i;
            items.add("{\"id\":" + id + ",\"imdb_id\":\"tt" + (1000000 + id) + "\",\"ids\":{\"tmdb\":" + id + "}}");
        }
        return items.toString();
    }

    @Test
    void testCanHandleMatchesDomainAndSubdomains() {
        MdbListAdapter adapter = adapter(new StubHttp(r -> StubHttp.Reply.ok("[]")), CONFIG);
        assertTrue(adapter.canHandle(LIST_URL));
        assertTrue(adapter.canHandle("HTTP://WWW.MDBLIST.COM/lists/a/b"));
        assertFalse(adapter.canHandle("https://notmdblist.com/lists/a/b"));
        assertFalse(adapter.canHandle("ftp://mdblist.com/lists/a/b"));
        assertFalse(adapter.canHandle(""));
        assertFalse(adapter.canHandle(null));
    }

    @Test
    void testPaginationStopsOnShortPage() throws Exception {
        StubHttp http = new StubHttp(request -> {
            int offset = StubHttp.intQuery(request, "offset");
            return StubHttp.Reply.ok(offset == 0 ? bareArray(1, 1000) : bareArray(1001, 1));
        });

        FetchResult result = adapter(http, CONFIG).fetch(LIST_URL, CancellationToken.none());

        assertEquals(1001, result.totalItems());
        assertEquals(2, http.requestCount());
        assertEquals(0, StubHttp.intQuery(http.requests().get(0), "offset"));
        assertEquals(1000, StubHttp.intQuery(http.requests().get(1), "offset"));
        assertEquals("1000", StubHttp.query(http.requests().get(0), "limit"));
        assertEquals("mdb-key", StubHttp.query(http.requests().get(0), "apikey"));
        assertEquals("/lists/jdoe/top-horror/items", http.requests().get(0).uri().getPath());
        assertEquals(1000, result.imdbIds().get("tt1001001"));
    }

    @Test
    void testWrapperShapeProcessesMoviesBeforeShows() throws Exception {
        String json = "{\"shows\":[{\"imdb_id\":\"tt0000003\",\"tvdb_id\":77}],"
            + "\"movies\":[{\"imdb_id\":\"tt0000001\"},{\"imdb_id\":\"tt0000002\"}]}";
        StubHttp http = new StubHttp(r -> StubHttp.Reply.ok(json));

        FetchResult result = adapter(http, CONFIG).fetch(LIST_URL, CancellationToken.none());

        assertEquals(3, result.totalItems());
        assertEquals(0, result.imdbIds().get("tt0000001"));
        assertEquals(1, result.imdbIds().get("tt0000002"));
        assertEquals(2, result.imdbIds().get("tt0000003"));
        assertEquals(2, result.tvdbIds().get("77"));
        assertEquals(1, http.requestCount());
    }

    @Test
    void testPositionAdvancesForItemsWithoutIds() throws Exception {
        String json = "[{\"imdb_id\":\"tt0000001\"},{\"title\":\"No ids at all\"},{\"ids\":{\"imdb\":\"tt0000003\",\"tmdb\":0}}]";
        StubHttp http = new StubHttp(r -> StubHttp.Reply.ok(json));

        FetchResult result = adapter(http, CONFIG).fetch(LIST_URL, CancellationToken.none());

        assertEquals(3, result.totalItems());
        assertEquals(0, result.imdbIds().get("tt0000001"));
        assertEquals(2, result.imdbIds().get("tt0000003"));
        assertTrue(result.tmdbIds().isEmpty());
    }

    @Test
    void testTopLevelIdsTakePrecedenceOverNestedIds() throws Exception {
        String json = "[{\"imdb_id\":\"tt1111111\",\"tvdb_id\":5,\"ids\":{\"imdb\":\"tt9999999\",\"tmdb\":42,\"tvdb\":6}}]";
        StubHttp http = new StubHttp(r -> StubHttp.Reply.ok(json));

        FetchResult result = adapter(http, CONFIG).fetch(LIST_URL, CancellationToken.none());

        assertEquals(List.of("tt1111111"), List.copyOf(result.imdbIds().keySet()));
        assertEquals(List.of("5"), List.copyOf(result.tvdbIds().keySet()));
        assertEquals(0, result.tmdbIds().get("42"));
    }

    @Test
    void testDuplicateIdKeepsFirstPosition() throws Exception {
        String json = "[{\"imdb_id\":\"tt0000001\"},{\"imdb_id\":\"tt0000002\"},{\"imdb_id\":\"tt0000001\"}]";
        StubHttp http = new StubHttp(r -> StubHttp.Reply.ok(json));

        FetchResult result = adapter(http, CONFIG).fetch(LIST_URL, CancellationToken.none());

        assertEquals(0, result.imdbIds().get("tt0000001"));
        assertEquals(2, result.imdbIds().size());
        assertEquals(3, result.totalItems());
    }

    @Test
    void testMissingApiKeyIsFatal() {
        StubHttp http = new StubHttp(r -> StubHttp.Reply.ok("[]"));
        ListFetchException e = assertThrows(ListFetchException.class,
            () -> adapter(http, new ExternalListConfig(" ", "", "")).fetch(LIST_URL, CancellationToken.none()));
        assertTrue(e.getMessage().contains("API key"));
        assertEquals(0, http.requestCount());
    }

    @Test
    void testUnroutableUrlIsFatal() {
        StubHttp http = new StubHttp(r -> StubHttp.Reply.ok("[]"));
        assertThrows(ListFetchException.class,
            () -> adapter(http, CONFIG).fetch("https://mdblist.com/toplists", CancellationToken.none()));
        assertEquals(0, http.requestCount());
    }

    @Test
    void testFailedFirstPageIsFatal() {
        StubHttp http = new StubHttp(r -> StubHttp.Reply.status(503));
        assertThrows(ListFetchException.class, () -> adapter(http, CONFIG).fetch(LIST_URL, CancellationToken.none()));
    }

    @Test
    void testMalformedFirstPageIsFatal() {
        StubHttp http = new StubHttp(r -> StubHttp.Reply.ok("<html>maintenance</html>"));
        assertThrows(ListFetchException.class, () -> adapter(http, CONFIG).fetch(LIST_URL, CancellationToken.none()));
    }

    @Test
    void testFailureAfterFirstPageKeepsPartialResult() throws Exception {
        StubHttp http = new StubHttp(request -> {
            if (StubHttp.intQuery(request, "offset") == 0) {
                return StubHttp.Reply.ok(bareArray(1, 1000));
            }
            throw new IOException("connection reset");
        });

        FetchResult result = adapter(http, CONFIG).fetch(LIST_URL, CancellationToken.none());

        assertEquals(1000, result.totalItems());
        assertEquals(1000, result.imdbIds().size());
        assertEquals(2, http.requestCount());
        assertTrue(result.isTruncated());
        assertTrue(result.truncationReason().contains("connection reset"));
    }

    @Test
    void testImdbIdsAreNormalizedToLowerCase() throws Exception {
        StubHttp http = new StubHttp(r -> StubHttp.Reply.ok(
            "[{\"imdb_id\":\"TT0000001\"},{\"ids\":{\"imdb\":\" tt0000002 \"}},{\"imdb_id\":\"tt0000001\"}]"));

        FetchResult result = adapter(http, CONFIG).fetch(LIST_URL, CancellationToken.none());

        assertEquals(0, result.imdbIds().get("tt0000001"));
        assertEquals(1, result.imdbIds().get("tt0000002"));
        assertEquals(2, result.imdbIds().size());
        assertFalse(result.isTruncated());
    }

    @Test
    void testCancelledTokenStopsBeforeFirstRequest() {
        StubHttp http = new StubHttp(r -> StubHttp.Reply.ok("[]"));
        CancellationToken token = new CancellationToken();
        token.cancel();
        assertThrows(CancellationException.class, () -> adapter(http, CONFIG).fetch(LIST_URL, token));
        assertEquals(0, http.requestCount());
    }

    @Test
    void testEmptyListIsNotAnError() throws Exception {
        StubHttp http = new StubHttp(r -> StubHttp.Reply.ok("{\"movies\":[],\"shows\":[]}"));
        FetchResult result = adapter(http, CONFIG).fetch(LIST_URL, CancellationToken.none());
        assertTrue(result.isEmpty());
        assertFalse(result.isTruncated());
        HttpRequest request = http.requests().get(0);
        assertEquals("api.mdblist.com", request.uri().getHost());
    }
}
