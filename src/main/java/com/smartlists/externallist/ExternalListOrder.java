package com.smartlists.externallist;

import java.util.Comparator;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * Sort orders that rank library items by their position in a cached external list.
 * Items not present in the list always sort last, in both directions.
 */
public final class ExternalListOrder {
    private ExternalListOrder() {}

    /**
     * @param cache populated batch cache
     * @param url external list URL to rank against
     * @param idsOf extracts provider identifiers from an item
     * @return comparator placing items in list order
     */
    public static <T> Comparator<T> ascending(FetchCache cache, String url, Function<T, ProviderIds> idsOf) {
        return Comparator.comparingInt(item -> sortKey(cache, url, idsOf.apply(item), false));
    }

    /**
     * Same as {@link #ascending} but in reverse list order.
     */
    public static <T> Comparator<T> descending(FetchCache cache, String url, Function<T, ProviderIds> idsOf) {
        return Comparator.comparingInt(item -> sortKey(cache, url, idsOf.apply(item), true));
    }

    private static int sortKey(FetchCache cache, String url, ProviderIds ids, boolean descending) {
        OptionalInt position = cache.positionOf(url, ids);
        if (position.isEmpty()) {
            return Integer.MAX_VALUE;
        }
        return descending ? -position.getAsInt() : position.getAsInt();
    }
}
