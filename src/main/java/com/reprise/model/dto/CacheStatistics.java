package com.reprise.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Cache counters since process start.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Exact hits keyed by the tier that served them ("memory", "redis", "file").
     */
    private Map<String, Long> hitsByTier;

    /**
     * Hits served by the approximate (paraphrase) matcher.
     */
    private long approximateHits;

    private long misses;

    /**
     * Tier read/write failures that were logged and skipped.
     */
    private long tierErrors;

    /**
     * Values copied into faster tiers after a hit in a slower one.
     */
    private long promotions;

    private long memoryEntries;

    /**
     * Hit rate over all lookups, video status included (0.0-1.0).
     */
    private double hitRate;
}
