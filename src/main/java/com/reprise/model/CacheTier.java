package com.reprise.model;

/**
 * Backing stores of the cache hierarchy, fastest first.
 */
public enum CacheTier {
    MEMORY,     // In-process bounded Caffeine map
    REDIS,      // Persistent key-value store
    FILE        // Flat per-entity JSON files, the durable source of truth
}
