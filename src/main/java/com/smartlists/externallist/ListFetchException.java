package com.smartlists.externallist;

/**
 * Raised by an adapter when a URL cannot yield any result: a missing credential, a URL that does
 * not route to a request target, or a failed first page. The aggregator records it as a warning
 * and stores an empty result for the URL.
 */
public class ListFetchException extends Exception {

    public ListFetchException(String message) {
        super(message);
    }

    public ListFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
