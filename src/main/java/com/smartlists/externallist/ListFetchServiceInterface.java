package com.smartlists.externallist;

import java.util.Collection;

/**
 * Interface for populating a batch {@link FetchCache} from external list URLs.
 */
public interface ListFetchServiceInterface {

    /**
     * Fetches every URL not yet present in the cache, sequentially, and stores one result per URL.
     * A URL that has no adapter or whose fetch fails gets an empty result and a warning on the cache.
     * Calling it again with the same URLs issues no further requests.
     *
     * @param urls external list URLs, duplicates compared case-insensitively
     * @param cache batch cache to populate
     * @param token cancellation signal for the whole call
     * @throws java.util.concurrent.CancellationException if cancelled; URLs cached before that stay cached
     */
    void preFetch(Collection<String> urls, FetchCache cache, CancellationToken token);
}
