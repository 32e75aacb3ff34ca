package com.smartlists.externallist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Resolves external list URLs to adapters and fills the batch cache.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Drops duplicate URLs (case-insensitive) and URLs already cached in this batch.</li>
 *   <li>Picks the first adapter, in registration order, whose {@code canHandle} accepts the URL.</li>
 *   <li>Fetches URLs one after another; there is no fan-out across URLs or pages.</li>
 * </ul>
 * <p>
 * Error Handling:
 * <ul>
 *   <li>No matching adapter: warning plus an empty result for the URL.</li>
 *   <li>Any fetch failure: warning with the URL and cause, plus an empty result.</li>
 *   <li>Paging stopped early after some items were read: the partial result is kept with a warning.</li>
 *   <li>Cancellation propagates to the caller and stops the batch; results cached so far remain.</li>
 * </ul>
 *
 * @author Smart Lists Team
 * @since 1.0
 */
public class ListFetchService implements ListFetchServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(ListFetchService.class);

    private final List<ListAdapterInterface> adapters;

    /**
     * @param adapters adapters in priority order; the first match for a URL wins
     */
    public ListFetchService(List<? extends ListAdapterInterface> adapters) {
        if (adapters == null) {
            throw new IllegalArgumentException("Adapter list cannot be null");
        }
        this.adapters = List.copyOf(adapters);
    }

    @Override
    public void preFetch(Collection<String> urls, FetchCache cache, CancellationToken token) {
        if (urls == null || cache == null || token == null) {
            throw new IllegalArgumentException("urls, cache and token are required");
        }
        List<String> urlList = distinctIgnoreCase(urls);
        if (urlList.isEmpty()) {
            return;
        }
        logger.info("Pre-fetching {} external list(s)", urlList.size());

        for (String url : urlList) {
            token.throwIfCancellationRequested();

            if (cache.contains(url)) {
                logger.debug("External list already cached: {}", url);
                continue;
            }

            ListAdapterInterface adapter = findAdapter(url);
            if (adapter == null) {
                String msg = "No list adapter found for URL: " + url;
                logger.warn(msg);
                cache.addWarning(msg);
                cache.put(url, FetchResult.empty());
                continue;
            }

            try {
                FetchResult result = adapter.fetch(url, token);
                cache.put(url, result == null ? FetchResult.empty() : result);
                logger.debug("Cached external list {}: {}", url, result);
                if (result != null && result.isTruncated()) {
                    cache.addWarning("Partially fetched external list: " + url + " (" + result.truncationReason() + ")");
                }
            } catch (CancellationException e) {
                logger.debug("External list fetch cancelled for {}", url);
                throw e;
            } catch (ListFetchException | RuntimeException e) {
                String msg = "Failed to fetch external list: " + url + " (" + e.getMessage() + ")";
                logger.warn("Failed to fetch external list: {}. Treating as empty list.", url, e);
                cache.addWarning(msg);
                cache.put(url, FetchResult.empty());
            }
        }
    }

    /**
     * @return the first registered adapter accepting the URL, or null
     */
    ListAdapterInterface findAdapter(String url) {
        for (ListAdapterInterface adapter : adapters) {
            if (adapter.canHandle(url)) {
                return adapter;
            }
        }
        return null;
    }

    private static List<String> distinctIgnoreCase(Collection<String> urls) {
        Map<String, String> seen = new LinkedHashMap<>();
        for (String url : urls) {
            if (url == null || url.isBlank()) {
                continue;
            }
            String trimmed = url.trim();
            seen.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
        }
        return new ArrayList<>(seen.values());
    }
}
