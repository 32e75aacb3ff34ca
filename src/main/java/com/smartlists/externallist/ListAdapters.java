package com.smartlists.externallist;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.util.List;

/**
 * Builds the standard adapter chain. The order is the resolution order used by
 * {@link ListFetchService}: MDBList, IMDb, TMDB, Trakt.
 */
public final class ListAdapters {
    private ListAdapters() {}

    public static List<ListAdapterInterface> defaultAdapters(HttpClient httpClient, ObjectMapper mapper, ExternalListConfig config) {
        return List.of(
            new MdbListAdapter(httpClient, mapper, config),
            new ImdbListAdapter(httpClient, config),
            new TmdbListAdapter(httpClient, mapper, config),
            new TraktListAdapter(httpClient, mapper, config)
        );
    }

    /**
     * Convenience overload creating a redirect-following HTTP client and a lenient object mapper.
     */
    public static List<ListAdapterInterface> defaultAdapters(ExternalListConfig config) {
        return defaultAdapters(newHttpClient(config), newObjectMapper(), config);
    }

    public static HttpClient newHttpClient(ExternalListConfig config) {
        return HttpClient.newBuilder()
            .connectTimeout(config.requestTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
