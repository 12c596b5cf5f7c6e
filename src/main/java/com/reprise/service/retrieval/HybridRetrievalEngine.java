package com.reprise.service.retrieval;

import com.reprise.config.RepriseProperties;
import com.reprise.exception.UpstreamUnavailableException;
import com.reprise.model.Passage;
import com.reprise.model.RankedCandidate;
import com.reprise.provider.DenseSimilarityProvider;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Hybrid passage retrieval: dense similarity plus BM25, merged by {@link ScoreFusion}.
 *
 * Flow:
 * 1. Dense candidates from the vector index (bounded by a timeout)
 * 2. Lexical candidates from the video's BM25 index; a video without lexical passages
 *    (e.g. after a restart) gets an index built from the dense candidates first
 * 3. Position-normalized weighted fusion, top k texts
 *
 * The dense call is skipped only when its weight is 0.0 and the lexical index needs no seed.
 * A failed dense call degrades to lexical-only results or fails the search, per configuration.
 * Both signals failing is always an error. Both signals returning nothing is an empty result.
 */
@Slf4j
@Service
public class HybridRetrievalEngine {

    private final DenseSimilarityProvider denseProvider;
    private final LexicalIndexBuilder lexicalIndex;
    private final ScoreFusion fusion;
    private final RepriseProperties properties;

    public HybridRetrievalEngine(DenseSimilarityProvider denseProvider,
                                 LexicalIndexBuilder lexicalIndex,
                                 ScoreFusion fusion,
                                 RepriseProperties properties) {
        this.denseProvider = denseProvider;
        this.lexicalIndex = lexicalIndex;
        this.fusion = fusion;
        this.properties = properties;
    }

    /**
     * Fused passage texts, best first. Empty when the video has no context.
     */
    public Mono<List<String>> hybridSearch(String videoId, String query, int k, double vectorWeight) {
        return search(videoId, query, k, vectorWeight).map(RetrievalResult::getPassages);
    }

    /**
     * Fused passage texts plus whether the dense side was dropped.
     *
     * @param videoId namespace
     * @param query query text
     * @param k maximum results, at least 1
     * @param vectorWeight dense weight in [0, 1]; 1.0 is pure dense, 0.0 pure lexical
     */
    public Mono<RetrievalResult> search(String videoId, String query, int k, double vectorWeight) {
        if (k < 1) {
            return Mono.error(new IllegalArgumentException("k must be at least 1: " + k));
        }
        if (vectorWeight < 0.0 || vectorWeight > 1.0) {
            return Mono.error(new IllegalArgumentException("vectorWeight must be within [0, 1]: " + vectorWeight));
        }

        boolean seedLexical = lexicalIndex.passageCount(videoId) == 0;

        return denseCandidates(videoId, query, k, vectorWeight, seedLexical)
                .flatMap(dense -> lexicalCandidates(videoId, query, k, dense)
                        .flatMap(lexical -> combine(videoId, dense, lexical, vectorWeight, k)));
    }

    private Mono<RetrievalResult> combine(String videoId, Signal dense, Signal lexical, double vectorWeight, int k) {
        if (dense.isFailed() && lexical.isFailed()) {
            log.error("Both retrieval signals failed for video {}", videoId);
            return Mono.error(new UpstreamUnavailableException(
                    "Dense and lexical retrieval both failed for video " + videoId, dense.getError()));
        }

        if (dense.isFailed()) {
            if (properties.getRetrieval().getDenseFailurePolicy() == RepriseProperties.DenseFailurePolicy.FAIL) {
                return Mono.error(new UpstreamUnavailableException(
                        "Dense similarity search failed for video " + videoId, dense.getError()));
            }
            log.warn("Dense similarity unavailable for video {}, using lexical results only: {}",
                    videoId, dense.getError().toString());
            List<String> passages = fusion.fuse(List.of(), lexical.getCandidates(), 0.0, k);
            return Mono.just(new RetrievalResult(passages, true));
        }

        List<String> passages = fusion.fuse(dense.getCandidates(), lexical.getCandidates(), vectorWeight, k);
        if (passages.isEmpty()) {
            log.debug("No context found for video {}", videoId);
        }
        return Mono.just(new RetrievalResult(passages, false));
    }

    private Mono<Signal> denseCandidates(String videoId, String query, int k, double vectorWeight,
                                         boolean seedLexical) {
        if (vectorWeight == 0.0 && !seedLexical) {
            // Dense scores would be weighted to zero
            return Mono.just(Signal.of(List.of()));
        }
        return denseProvider.similaritySearch(videoId, query, k)
                .timeout(properties.getRetrieval().getDenseTimeout())
                .map(Signal::of)
                .defaultIfEmpty(Signal.of(List.of()))
                .onErrorResume(error -> Mono.just(Signal.failed(error)));
    }

    private Mono<Signal> lexicalCandidates(String videoId, String query, int k, Signal dense) {
        List<Passage> seed = dense.getCandidates().stream()
                .map(RankedCandidate::getPassage)
                .toList();
        return Mono.fromCallable(() -> lexicalIndex.search(videoId, query, k, seed))
                .subscribeOn(Schedulers.boundedElastic())
                .map(Signal::of)
                .onErrorResume(error -> {
                    log.warn("Lexical search failed for video {}", videoId, error);
                    return Mono.just(Signal.failed(error));
                });
    }

    /**
     * Fusion output.
     */
    @Data
    @AllArgsConstructor
    public static class RetrievalResult {
        private List<String> passages;

        /**
         * True when the dense side failed and only lexical results were used.
         */
        private boolean degraded;
    }

    /**
     * Outcome of one retrieval path.
     */
    @Data
    @AllArgsConstructor
    private static class Signal {
        private List<RankedCandidate> candidates;
        private boolean failed;
        private Throwable error;

        static Signal of(List<RankedCandidate> candidates) {
            return new Signal(candidates, false, null);
        }

        static Signal failed(Throwable error) {
            return new Signal(List.of(), true, error);
        }
    }
}
