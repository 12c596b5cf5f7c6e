package com.reprise.model;

/**
 * HTTP response headers describing cache provenance of an answer.
 */
public class CacheHeaders {

    /**
     * Whether the answer came from cache.
     * Value: "true" or "false"
     */
    public static final String CACHE_HIT = "x-cache-hit";

    /**
     * Type of cache match.
     * Values: "exact", "approximate", "none"
     */
    public static final String CACHE_MATCH = "x-cache-match";

    /**
     * Similarity score of the match.
     * Value: 0.0-1.0 (string formatted to 3 decimals), 1.000 for exact hits
     */
    public static final String CACHE_SCORE = "x-cache-score";

    /**
     * Tier that served the hit.
     * Values: "memory", "redis", "file"
     */
    public static final String CACHE_TIER = "x-cache-tier";

    /**
     * Age of cached entry in seconds.
     */
    public static final String CACHE_AGE = "x-cache-age";

    /**
     * Present with "true" when hybrid retrieval ran without the dense-similarity signal.
     */
    public static final String RETRIEVAL_DEGRADED = "x-retrieval-degraded";

    private CacheHeaders() {
        // Utility class, no instantiation
    }
}
