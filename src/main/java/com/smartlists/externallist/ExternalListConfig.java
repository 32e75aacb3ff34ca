package com.smartlists.externallist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Credentials and transport settings for the external list adapters.
 * <p>
 * Credentials may be blank; an adapter whose credential is missing fails when it is asked to fetch,
 * not when it is constructed, so lists from other sources keep working.
 *
 * @param mdbListApiKey MDBList API key
 * @param tmdbApiKey TMDB v3 API key
 * @param traktClientId Trakt application client id
 * @param requestTimeout timeout applied to every HTTP request
 */
public record ExternalListConfig(
    String mdbListApiKey,
    String tmdbApiKey,
    String traktClientId,
    Duration requestTimeout
) {
    private static final Logger logger = LoggerFactory.getLogger(ExternalListConfig.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public ExternalListConfig {
        mdbListApiKey = mdbListApiKey == null ? "" : mdbListApiKey.trim();
        tmdbApiKey = tmdbApiKey == null ? "" : tmdbApiKey.trim();
        traktClientId = traktClientId == null ? "" : traktClientId.trim();
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            requestTimeout = DEFAULT_TIMEOUT;
        }
    }

    public ExternalListConfig(String mdbListApiKey, String tmdbApiKey, String traktClientId) {
        this(mdbListApiKey, tmdbApiKey, traktClientId, DEFAULT_TIMEOUT);
    }

    /**
     * Reads settings from environment variables, falling back to JVM system properties:
     * MDBLIST_API_KEY, TMDB_API_KEY, TRAKT_CLIENT_ID and EXTERNAL_LIST_TIMEOUT_SECONDS.
     */
    public static ExternalListConfig fromEnvironment() {
        Duration timeout = DEFAULT_TIMEOUT;
        String timeoutStr = envOrProp("EXTERNAL_LIST_TIMEOUT_SECONDS", "");
        if (!timeoutStr.isBlank()) {
            try {
                timeout = Duration.ofSeconds(Long.parseLong(timeoutStr.trim()));
            } catch (NumberFormatException e) {
                logger.warn("Invalid EXTERNAL_LIST_TIMEOUT_SECONDS '{}', using {}s", timeoutStr, DEFAULT_TIMEOUT.toSeconds());
            }
        }
        return new ExternalListConfig(
            envOrProp("MDBLIST_API_KEY", ""),
            envOrProp("TMDB_API_KEY", ""),
            envOrProp("TRAKT_CLIENT_ID", ""),
            timeout
        );
    }

    private static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null) return ev;
        String prop = System.getProperty(key);
        return prop != null ? prop : defaultVal;
    }
}
