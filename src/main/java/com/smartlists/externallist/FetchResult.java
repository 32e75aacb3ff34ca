package com.smartlists.externallist;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Normalized output of one external list fetch.
 * <p>
 * Holds one index per provider identifier family, each mapping an identifier to its zero-based
 * position in the source list:
 * <ul>
 *   <li>{@code imdbIds} - "tt"-prefixed IMDb identifiers, trimmed and lower-cased.</li>
 *   <li>{@code tmdbIds} - numeric TMDB identifiers, stored as strings.</li>
 *   <li>{@code tvdbIds} - numeric TVDB identifiers, stored as strings.</li>
 * </ul>
 * Positions are assigned in source-scan order and the first occurrence of an identifier wins.
 * An empty family means the source carries no information for it, not that the fetch failed.
 * <p>
 * Adapters populate a result through the package-private mutators; consumers only see read-only views.
 *
 * @author Smart Lists Team
 * @since 1.0
 */
public final class FetchResult {
    private final Map<String, Integer> imdbIds = new LinkedHashMap<>();
    private final Map<String, Integer> tmdbIds = new LinkedHashMap<>();
    private final Map<String, Integer> tvdbIds = new LinkedHashMap<>();
    private int totalItems;
    private String truncationReason;

    FetchResult() {
    }

    /**
     * Returns a result with no identifiers and zero items, used for unresolved or failed URLs.
     */
    public static FetchResult empty() {
        return new FetchResult();
    }

    public Map<String, Integer> imdbIds() {
        return Collections.unmodifiableMap(imdbIds);
    }

    public Map<String, Integer> tmdbIds() {
        return Collections.unmodifiableMap(tmdbIds);
    }

    public Map<String, Integer> tvdbIds() {
        return Collections.unmodifiableMap(tvdbIds);
    }

    public int totalItems() {
        return totalItems;
    }

    /**
     * @return true when no family holds an identifier and no item was observed
     */
    public boolean isEmpty() {
        return totalItems == 0 && imdbIds.isEmpty() && tmdbIds.isEmpty() && tvdbIds.isEmpty();
    }

    void addImdbId(String id, int position) {
        if (id != null && !id.isBlank()) {
            imdbIds.putIfAbsent(id.trim().toLowerCase(Locale.ROOT), position);
        }
    }

    void addTmdbId(Integer id, int position) {
        if (id != null && id > 0) {
            tmdbIds.putIfAbsent(id.toString(), position);
        }
    }

    void addTvdbId(Integer id, int position) {
        if (id != null && id > 0) {
            tvdbIds.putIfAbsent(id.toString(), position);
        }
    }

    /**
     * @return true when paging stopped on an error after some items were read
     */
    public boolean isTruncated() {
        return truncationReason != null;
    }

    /**
     * @return why paging stopped early, or null for a complete list
     */
    public String truncationReason() {
        return truncationReason;
    }

    void setTotalItems(int totalItems) {
        this.totalItems = totalItems;
    }

    void markTruncated(String reason) {
        if (truncationReason == null) {
            truncationReason = reason;
        }
    }

    @Override
    public String toString() {
        return "FetchResult{totalItems=" + totalItems
            + ", imdb=" + imdbIds.size()
            + ", tmdb=" + tmdbIds.size()
            + ", tvdb=" + tvdbIds.size()
            + (truncationReason != null ? ", truncated" : "") + "}";
    }
}
