package com.smartlists.externallist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Command-line entry point that runs one fetch batch over the URLs given as arguments and prints
 * what each source returned.
 * <p>
 * Credentials are read by {@link ExternalListConfig#fromEnvironment()}.
 *
 * @author Smart Lists Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CANCELLED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        ExternalListConfig config = ExternalListConfig.fromEnvironment();
        ListFetchServiceInterface service = new ListFetchService(ListAdapters.defaultAdapters(config));
        int code = run(args, service, System.out);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Runs a single batch and writes a summary.
     * @param args External list URLs
     * @param service Aggregator to run the batch with
     * @param out Destination for the summary
     * @return Process exit code
     */
    static int run(String[] args, ListFetchServiceInterface service, PrintStream out) {
        if (args == null || args.length == 0) {
            out.println("Usage: external-lists <list-url> [<list-url> ...]");
            out.println("Credentials: MDBLIST_API_KEY, TMDB_API_KEY, TRAKT_CLIENT_ID (env or -D system property)");
            return EXIT_USAGE;
        }
        List<String> urls = Arrays.asList(args);
        FetchCache cache = new FetchCache();
        CancellationToken token = new CancellationToken();
        Thread hook = new Thread(token::cancel, "external-list-cancel");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            service.preFetch(urls, cache, token);
        } catch (CancellationException e) {
            logger.warn("Batch cancelled after {} of {} list(s)", cache.size(), urls.size());
            printSummary(urls, cache, out);
            return EXIT_CANCELLED;
        } finally {
            removeHook(hook);
        }
        printSummary(urls, cache, out);
        return EXIT_OK;
    }

    private static void printSummary(List<String> urls, FetchCache cache, PrintStream out) {
        for (String url : urls) {
            FetchResult result = cache.get(url);
            if (result == null) {
                out.println(url + " -> not fetched");
                continue;
            }
            out.printf("%s -> %d items (IMDb: %d, TMDB: %d, TVDB: %d)%n", url, result.totalItems(),
                result.imdbIds().size(), result.tmdbIds().size(), result.tvdbIds().size());
        }
        for (String warning : cache.warnings()) {
            out.println("WARNING: " + warning);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("JVM is shutting down, cancel hook stays registered");
        }
    }
}
