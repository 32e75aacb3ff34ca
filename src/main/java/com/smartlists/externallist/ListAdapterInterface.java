package com.smartlists.externallist;

/**
 * Interface for fetching a ranked title list from one external source.
 * <p>
 * Each implementation owns one host and one wire protocol. The aggregator selects the first
 * registered adapter whose {@link #canHandle(String)} accepts a URL, so registration order decides
 * ties.
 */
public interface ListAdapterInterface {

    /**
     * Checks whether this adapter serves the given URL. Matches on http/https scheme and on the
     * adapter's domain or any of its subdomains, case-insensitively. Never performs I/O.
     *
     * @param url external list URL
     * @return true if this adapter can fetch the list
     */
    boolean canHandle(String url);

    /**
     * Fetches every page of the list and returns its provider identifiers in list order.
     * <p>
     * Network and parse failures after at least one item was read degrade to a partial result.
     *
     * @param url external list URL accepted by {@link #canHandle(String)}
     * @param token cancellation signal checked before each page request
     * @return normalized identifiers and item count
     * @throws ListFetchException if a credential is missing, the URL does not route to a request
     *         target, or nothing could be read
     * @throws java.util.concurrent.CancellationException if the token was cancelled
     */
    FetchResult fetch(String url, CancellationToken token) throws ListFetchException;
}
