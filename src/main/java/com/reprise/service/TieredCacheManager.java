package com.reprise.service;

import com.reprise.exception.StorageUnavailableException;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheKey;
import com.reprise.model.CacheTier;
import com.reprise.model.EntityKind;
import com.reprise.model.TierLookup;
import com.reprise.model.dto.CacheStatistics;
import com.reprise.repository.MemoryTierStore;
import com.reprise.repository.TierStore;
import com.reprise.service.canonicalization.QueryNormalizer;
import com.reprise.service.similarity.ApproximateMatcher;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Multi-tier cache for video status and query responses.
 *
 * Flow:
 * 1. Check the tiers fastest first (memory, Redis, file)
 * 2. On a valid hit, copy the entry into every faster tier, then return
 * 3. Query responses that miss everywhere fall back to approximate matching
 *
 * Writes go through to every tier. Only the durable tier's write failures reach the caller.
 */
@Slf4j
public class TieredCacheManager {

    private final List<TierStore> tiers;
    private final ApproximateMatcher approximateMatcher;
    private final QueryNormalizer normalizer;
    private final Clock clock;
    private final Duration ttl;

    private final Map<CacheTier, AtomicLong> hitsByTier = new EnumMap<>(CacheTier.class);
    private final AtomicLong approximateHits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong tierErrors = new AtomicLong();
    private final AtomicLong promotions = new AtomicLong();

    /**
     * @param tiers tier stores, fastest first; at least one must be durable
     */
    public TieredCacheManager(List<TierStore> tiers,
                              ApproximateMatcher approximateMatcher,
                              QueryNormalizer normalizer,
                              Clock clock,
                              Duration ttl) {
        if (tiers.isEmpty() || tiers.stream().noneMatch(TierStore::isDurable)) {
            throw new IllegalArgumentException("At least one durable cache tier is required");
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        this.tiers = List.copyOf(tiers);
        this.approximateMatcher = approximateMatcher;
        this.normalizer = normalizer;
        this.clock = clock;
        this.ttl = ttl;
        for (CacheTier tier : CacheTier.values()) {
            hitsByTier.put(tier, new AtomicLong());
        }
        log.info("Cache tiers: {}, ttl={}", this.tiers.stream().map(TierStore::tier).toList(), ttl);
    }

    /**
     * Whether the video has a valid processed marker in any tier.
     */
    public boolean hasProcessed(String videoId) {
        CacheKey key = CacheKey.videoStatus(videoId);
        return lookup(key)
                .map(found -> Boolean.TRUE.equals(found.getEntry().getProcessed()))
                .orElse(false);
    }

    /**
     * Write a fresh processed marker to every tier.
     *
     * @throws StorageUnavailableException if the durable tier fails
     */
    public void markProcessed(String videoId) {
        CacheKey.requireVideoId(videoId);
        writeThrough(CacheEntry.videoProcessed(videoId, clock.instant()));
        log.debug("Marked video {} as processed", videoId);
    }

    /**
     * Cached response for the question, exact or approximate.
     */
    public Optional<String> getResponse(String videoId, String query) {
        return lookupResponse(videoId, query).map(CacheResult::getResponse);
    }

    /**
     * Cached response with its provenance.
     *
     * @param videoId video id
     * @param query raw question
     * @return exact hit, else approximate hit, else empty
     */
    public Optional<CacheResult> lookupResponse(String videoId, String query) {
        long startTime = System.nanoTime();
        String normalized = normalizer.normalize(query);
        CacheKey key = CacheKey.queryResponse(videoId, normalizer.fingerprint(normalized));

        Optional<TierHit> exact = lookup(key);
        if (exact.isPresent()) {
            TierHit hit = exact.get();
            long latencyMs = (System.nanoTime() - startTime) / 1_000_000;
            log.info("Cache HIT (exact) from {} in {}ms, key={}", hit.getTier(), latencyMs, key);
            return Optional.of(toResult(hit.getEntry(), MatchType.EXACT, 1.0, hit.getTier()));
        }

        Optional<ApproximateMatcher.SimilarMatch> similar = approximateMatcher.findSimilar(videoId, normalized);
        if (similar.isPresent()) {
            ApproximateMatcher.SimilarMatch match = similar.get();
            approximateHits.incrementAndGet();
            long latencyMs = (System.nanoTime() - startTime) / 1_000_000;
            log.info("Cache HIT (approximate) in {}ms, score={}, video={}",
                    latencyMs, String.format(Locale.ROOT, "%.3f", match.getScore()), videoId);
            return Optional.of(toResult(match.getEntry(), MatchType.APPROXIMATE, match.getScore(), CacheTier.FILE));
        }

        misses.incrementAndGet();
        log.debug("Cache MISS for video {}, key={}", videoId, key);
        return Optional.empty();
    }

    /**
     * Store a response under the question's fingerprint in every tier. Last write wins.
     *
     * @throws StorageUnavailableException if the durable tier fails
     */
    public void putResponse(String videoId, String query, String response) {
        if (response == null) {
            throw new IllegalArgumentException("Response must not be null");
        }
        String normalized = normalizer.normalize(query);
        CacheKey key = CacheKey.queryResponse(videoId, normalizer.fingerprint(normalized));
        writeThrough(CacheEntry.queryResponse(key, normalized, response, clock.instant()));
        log.debug("Cached response: {}", key);
    }

    public CacheStatistics getStats() {
        Map<String, Long> hits = new LinkedHashMap<>();
        long exactHits = 0;
        for (Map.Entry<CacheTier, AtomicLong> entry : hitsByTier.entrySet()) {
            long count = entry.getValue().get();
            hits.put(entry.getKey().name().toLowerCase(Locale.ROOT), count);
            exactHits += count;
        }

        long served = exactHits + approximateHits.get();
        long total = served + misses.get();
        long memoryEntries = tiers.stream()
                .filter(MemoryTierStore.class::isInstance)
                .mapToLong(tier -> ((MemoryTierStore) tier).size())
                .sum();

        return CacheStatistics.builder()
                .hitsByTier(hits)
                .approximateHits(approximateHits.get())
                .misses(misses.get())
                .tierErrors(tierErrors.get())
                .promotions(promotions.get())
                .memoryEntries(memoryEntries)
                .hitRate(total == 0 ? 0.0 : (double) served / total)
                .build();
    }

    /**
     * Ordered lookup with promotion. Errors and expired entries fall through to the next tier.
     */
    private Optional<TierHit> lookup(CacheKey key) {
        Instant now = clock.instant();

        for (int i = 0; i < tiers.size(); i++) {
            TierStore store = tiers.get(i);
            TierLookup result = store.get(key);

            if (result.isError()) {
                tierErrors.incrementAndGet();
                log.warn("Skipping {} tier for {}: {}", store.tier(), key, result.getError().getMessage());
                continue;
            }
            if (!result.isHit()) {
                continue;
            }

            CacheEntry entry = rekey(result.getEntry(), key);
            if (!entry.isValidAt(now, ttl)) {
                log.debug("Expired entry in {} tier: {}", store.tier(), key);
                continue;
            }

            promote(entry, i);
            hitsByTier.get(store.tier()).incrementAndGet();
            return Optional.of(new TierHit(entry, store.tier()));
        }

        // Query misses are counted after the approximate fallback
        if (key.getKind() == EntityKind.VIDEO_STATUS) {
            misses.incrementAndGet();
        }
        return Optional.empty();
    }

    /**
     * Copy the entry into tiers [0, foundAt). Failures only cost a warm tier.
     */
    private void promote(CacheEntry entry, int foundAt) {
        for (int i = 0; i < foundAt; i++) {
            TierStore faster = tiers.get(i);
            try {
                faster.set(entry);
                promotions.incrementAndGet();
                log.debug("Promoted {} into {} tier", entry.getKey(), faster.tier());
            } catch (StorageUnavailableException e) {
                tierErrors.incrementAndGet();
                log.warn("Promotion of {} into {} tier failed", entry.getKey(), faster.tier(), e);
            }
        }
    }

    private void writeThrough(CacheEntry entry) {
        StorageUnavailableException durableFailure = null;

        for (TierStore store : tiers) {
            try {
                store.set(entry);
            } catch (StorageUnavailableException e) {
                tierErrors.incrementAndGet();
                if (store.isDurable()) {
                    log.error("Durable {} tier write failed for {}", store.tier(), entry.getKey(), e);
                    durableFailure = e;
                } else {
                    log.warn("Write to {} tier failed for {}, continuing", store.tier(), entry.getKey(), e);
                }
            }
        }

        if (durableFailure != null) {
            throw durableFailure;
        }
    }

    /**
     * Identity fields come from the lookup key; stored copies may omit them.
     */
    private CacheEntry rekey(CacheEntry entry, CacheKey key) {
        return entry.toBuilder()
                .kind(key.getKind())
                .videoId(key.getVideoId())
                .fingerprint(key.getFingerprint())
                .build();
    }

    private CacheResult toResult(CacheEntry entry, MatchType matchType, double score, CacheTier tier) {
        Duration age = Duration.between(entry.getCreatedAt(), clock.instant());
        return CacheResult.builder()
                .response(entry.getResponse())
                .matchType(matchType)
                .score(score)
                .tier(tier)
                .matchedQuery(entry.getQueryText())
                .createdAt(entry.getCreatedAt())
                .age(age.isNegative() ? Duration.ZERO : age)
                .build();
    }

    @Data
    @AllArgsConstructor
    private static class TierHit {
        private CacheEntry entry;
        private CacheTier tier;
    }

    /**
     * Cache lookup result.
     */
    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CacheResult {
        private String response;
        private MatchType matchType;
        private double score;
        private CacheTier tier;
        private String matchedQuery;
        private Instant createdAt;
        private Duration age;
    }

    /**
     * Match type.
     */
    public enum MatchType {
        EXACT,
        APPROXIMATE
    }
}
