package com.reprise.service.similarity;

import com.reprise.config.RepriseProperties;
import com.reprise.model.CacheEntry;
import com.reprise.model.SummaryLength;
import com.reprise.model.TierLookup;
import com.reprise.repository.FileTierStore;
import com.reprise.service.canonicalization.QueryNormalizer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Paraphrase fallback for query-response cache misses.
 *
 * Scans the video's non-expired query records in the durable tier and scores each
 * against the incoming question with token-set Jaccard similarity:
 * |A ∩ B| / |A ∪ B| over whitespace tokens of the case-folded texts.
 *
 * The best candidate wins only if its score is strictly above the threshold (default 0.5).
 * Candidates are scanned newest-first, so on equal scores the most recent answer wins.
 * Summaries share the query-record store but only ever match exactly, in both directions.
 * Best effort: unreadable records are skipped and a failed scan reports no match.
 */
@Slf4j
public class ApproximateMatcher {

    private final FileTierStore queryHistory;
    private final QueryNormalizer normalizer;
    private final RepriseProperties properties;
    private final Clock clock;

    public ApproximateMatcher(FileTierStore queryHistory,
                              QueryNormalizer normalizer,
                              RepriseProperties properties,
                              Clock clock) {
        this.queryHistory = queryHistory;
        this.normalizer = normalizer;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Find the response of the most similar earlier question about the same video.
     *
     * @param videoId video id
     * @param normalizedQuery normalized question
     * @return best match above threshold, if any
     */
    public Optional<SimilarMatch> findSimilar(String videoId, String normalizedQuery) {
        Set<String> queryTokens = normalizer.tokenize(normalizedQuery);
        if (queryTokens.isEmpty() || SummaryLength.isCacheQuery(normalizedQuery)) {
            return Optional.empty();
        }

        List<CacheEntry> candidates;
        try {
            candidates = liveCandidates(videoId);
        } catch (RuntimeException e) {
            log.warn("Approximate match scan failed for video {}, reporting no match", videoId, e);
            return Optional.empty();
        }

        double threshold = properties.getCache().getSimilarityThreshold();
        CacheEntry best = null;
        double bestScore = threshold;

        for (CacheEntry candidate : candidates) {
            Set<String> candidateTokens = normalizer.tokenize(candidate.getQueryText());
            if (candidateTokens.isEmpty()) {
                continue;
            }

            double similarity = jaccard(queryTokens, candidateTokens);
            if (similarity > bestScore) {
                bestScore = similarity;
                best = candidate;
            }
        }

        if (best == null) {
            log.debug("No approximate match above {} among {} candidates for video {}",
                    threshold, candidates.size(), videoId);
            return Optional.empty();
        }

        log.debug("Approximate match for video {}: '{}' ~ '{}' (score={})",
                videoId, normalizedQuery, best.getQueryText(), bestScore);
        return Optional.of(SimilarMatch.builder()
                .entry(best)
                .score(bestScore)
                .build());
    }

    /**
     * Jaccard similarity of two non-empty token sets.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        int union = a.size() + b.size() - intersection.size();
        return union == 0 ? 0.0 : (double) intersection.size() / union;
    }

    /**
     * Non-expired question records, newest first. Expired records and summaries never enter the pool.
     */
    private List<CacheEntry> liveCandidates(String videoId) {
        Instant now = clock.instant();
        Duration ttl = properties.getCache().getTtl();

        List<CacheEntry> live = new ArrayList<>();
        for (TierLookup lookup : queryHistory.scanQueryRecords(videoId)) {
            if (lookup.isError()) {
                log.warn("Skipping unreadable query record for video {}: {}",
                        videoId, lookup.getError().getMessage());
                continue;
            }
            CacheEntry entry = lookup.getEntry();
            if (SummaryLength.isCacheQuery(normalizer.normalize(entry.getQueryText()))) {
                continue;
            }
            if (entry.isValidAt(now, ttl)) {
                live.add(entry);
            }
        }
        live.sort(Comparator.comparing(CacheEntry::getCreatedAt).reversed());
        return live;
    }

    /**
     * Matched record and its similarity score.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SimilarMatch {
        private CacheEntry entry;
        private double score;
    }
}
