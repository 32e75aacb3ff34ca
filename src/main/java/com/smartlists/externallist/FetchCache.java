package com.smartlists.externallist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Per-batch cache of external list results.
 * <p>
 * Lifecycle:
 * <ul>
 *   <li>Created fresh at the start of a refresh batch.</li>
 *   <li>Populated once by {@link ListFetchServiceInterface#preFetch}.</li>
 *   <li>Read many times during rule evaluation, then discarded.</li>
 * </ul>
 * URLs are keyed case-insensitively, ignoring surrounding whitespace. A URL that is absent was never requested in this batch; a URL
 * mapped to an empty {@link FetchResult} was either genuinely empty or failed and was downgraded.
 * <p>
 * The cache is written only by the aggregator that owns it. Once {@code preFetch} returns no writer
 * remains, so concurrent readers need no synchronization.
 *
 * @author Smart Lists Team
 * @since 1.0
 */
public class FetchCache {
    private final Map<String, FetchResult> results = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();

    /**
     * @param url external list URL, compared case-insensitively
     * @return true if the URL has been resolved in this batch
     */
    public boolean contains(String url) {
        return url != null && results.containsKey(key(url));
    }

    /**
     * @param url external list URL, compared case-insensitively
     * @return cached result, or null if the URL was never requested in this batch
     */
    public FetchResult get(String url) {
        return url == null ? null : results.get(key(url));
    }

    /**
     * @return number of URLs resolved in this batch
     */
    public int size() {
        return results.size();
    }

    /**
     * Diagnostics recorded while fetching, one per URL that could not be resolved or fully fetched.
     */
    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Checks whether an item appears in a cached list under any of its provider identifiers.
     *
     * @param url external list URL
     * @param ids provider identifiers of the library item
     * @return true if any identifier is listed
     */
    public boolean isListed(String url, ProviderIds ids) {
        return positionOf(url, ids).isPresent();
    }

    /**
     * Looks up the rank of an item in a cached list. When several of the item's identifiers match,
     * the lowest position wins.
     *
     * @param url external list URL
     * @param ids provider identifiers of the library item
     * @return zero-based position, or empty if the item is not listed or the URL is not cached
     */
    public OptionalInt positionOf(String url, ProviderIds ids) {
        FetchResult result = get(url);
        if (result == null || ids == null) {
            return OptionalInt.empty();
        }
        int best = Integer.MAX_VALUE;
        best = Math.min(best, imdbPosition(result, ids.imdb()));
        best = Math.min(best, lookup(result.tmdbIds(), ids.tmdb()));
        best = Math.min(best, lookup(result.tvdbIds(), ids.tvdb()));
        return best == Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of(best);
    }

    void put(String url, FetchResult result) {
        results.put(key(url), result);
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }

    // stored IMDb ids are lower-case
    private static int imdbPosition(FetchResult result, String imdbId) {
        if (imdbId == null || imdbId.isBlank()) {
            return Integer.MAX_VALUE;
        }
        return lookup(result.imdbIds(), imdbId.toLowerCase(Locale.ROOT));
    }

    private static int lookup(Map<String, Integer> index, String id) {
        if (id == null || id.isBlank()) {
            return Integer.MAX_VALUE;
        }
        Integer position = index.get(id.trim());
        return position == null ? Integer.MAX_VALUE : position;
    }

    private static String key(String url) {
        return url.trim().toLowerCase(Locale.ROOT);
    }
}
