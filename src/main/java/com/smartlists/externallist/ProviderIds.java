package com.smartlists.externallist;

/**
 * Provider identifiers of a single library item, as known to the host media server.
 * Any of the fields may be null when the item has no identifier for that provider.
 *
 * @param imdb IMDb identifier, e.g. "tt0111161"
 * @param tmdb TMDB identifier as a numeric string
 * @param tvdb TVDB identifier as a numeric string
 */
public record ProviderIds(String imdb, String tmdb, String tvdb) {

    public static ProviderIds ofImdb(String imdb) {
        return new ProviderIds(imdb, null, null);
    }

    public static ProviderIds ofTmdb(String tmdb) {
        return new ProviderIds(null, tmdb, null);
    }

    public static ProviderIds ofTvdb(String tvdb) {
        return new ProviderIds(null, null, tvdb);
    }
}
