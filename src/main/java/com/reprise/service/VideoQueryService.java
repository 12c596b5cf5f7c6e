package com.reprise.service;

import com.reprise.config.RepriseProperties;
import com.reprise.exception.UpstreamUnavailableException;
import com.reprise.model.CacheKey;
import com.reprise.model.SearchMethod;
import com.reprise.model.SummaryLength;
import com.reprise.model.dto.AnswerChunk;
import com.reprise.model.dto.QueryAnswer;
import com.reprise.model.dto.SummaryResult;
import com.reprise.provider.AnswerProvider;
import com.reprise.service.retrieval.HybridRetrievalEngine;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;

/**
 * Answers questions about, and summarizes, indexed videos.
 *
 * Flow:
 * 1. Cache lookup (exact, then approximate)
 * 2. On miss, hybrid retrieval of transcript passages
 * 3. No passages: report no context without calling the model
 * 4. Otherwise ask the model and cache the answer
 *
 * Questions can also be answered as a token stream; see {@link #streamQuery}.
 */
@Slf4j
@Service
public class VideoQueryService {

    private static final String PASSAGE_SEPARATOR = "\n\n";

    private final TieredCacheManager cacheManager;
    private final HybridRetrievalEngine retrievalEngine;
    private final AnswerProvider answerProvider;
    private final StreamingService streamingService;
    private final RepriseProperties properties;

    public VideoQueryService(TieredCacheManager cacheManager,
                             HybridRetrievalEngine retrievalEngine,
                             AnswerProvider answerProvider,
                             StreamingService streamingService,
                             RepriseProperties properties) {
        this.cacheManager = cacheManager;
        this.retrievalEngine = retrievalEngine;
        this.answerProvider = answerProvider;
        this.streamingService = streamingService;
        this.properties = properties;
    }

    /**
     * Answer a question about a video.
     *
     * @param videoId video id
     * @param question user question
     * @param method retrieval mode, HYBRID when null
     * @param model chat model, the configured one when null
     */
    public Mono<QueryAnswer> query(String videoId, String question, SearchMethod method, String model) {
        validateQuestion(videoId, question);
        SearchMethod searchMethod = method != null ? method : SearchMethod.HYBRID;

        return lookup(videoId, question)
                .flatMap(cached -> {
                    if (cached.isPresent()) {
                        TieredCacheManager.CacheResult result = cached.get();
                        log.info("Serving {} cached answer for video {} (score={})",
                                result.getMatchType(), videoId, result.getScore());
                        return Mono.just(QueryAnswer.builder()
                                .videoId(videoId)
                                .answer(result.getResponse())
                                .contextAvailable(true)
                                .cached(true)
                                .cacheResult(result)
                                .build());
                    }
                    return answerFromTranscript(videoId, question, searchMethod, model);
                });
    }

    /**
     * Answer a question as a stream of tokens ending in one complete event.
     *
     * Cached answers are replayed in pieces. A fresh answer is cached once the model
     * stream completes; a stream that fails part way caches nothing.
     */
    public Flux<AnswerChunk> streamQuery(String videoId, String question, SearchMethod method, String model) {
        validateQuestion(videoId, question);
        SearchMethod searchMethod = method != null ? method : SearchMethod.HYBRID;

        return lookup(videoId, question)
                .flatMapMany(cached -> {
                    if (cached.isPresent()) {
                        String answer = cached.get().getResponse();
                        log.info("Replaying {} cached answer for video {}", cached.get().getMatchType(), videoId);
                        return streamingService.replay(answer)
                                .map(AnswerChunk::token)
                                .concatWith(Mono.just(AnswerChunk.complete(answer, true)));
                    }
                    return streamFromTranscript(videoId, question, searchMethod, model);
                });
    }

    /**
     * Summarize a video. An empty transcript yields an empty summary that is not cached.
     */
    public Mono<SummaryResult> summarize(String videoId, SummaryLength length) {
        CacheKey.requireVideoId(videoId);
        SummaryLength summaryLength = length != null ? length : SummaryLength.MEDIUM;
        String cacheQuery = summaryLength.cacheQuery();

        return lookup(videoId, cacheQuery)
                .flatMap(cached -> {
                    if (cached.isPresent()) {
                        log.info("Serving cached {} summary for video {}", summaryLength, videoId);
                        return Mono.just(summaryResult(videoId, summaryLength, cached.get().getResponse(), true));
                    }

                    RepriseProperties.RetrievalConfig retrieval = properties.getRetrieval();
                    return retrievalEngine.hybridSearch(videoId, retrieval.getSummaryQuery(),
                                    retrieval.getSummaryK(), retrieval.getHybridVectorWeight())
                            .flatMap(passages -> {
                                if (passages.isEmpty()) {
                                    log.warn("Transcript of video {} is empty, skipping summarization", videoId);
                                    return Mono.just(summaryResult(videoId, summaryLength, "", false));
                                }
                                return answerProvider.summarize(String.join(PASSAGE_SEPARATOR, passages), summaryLength)
                                        .flatMap(summary -> store(videoId, cacheQuery, summary))
                                        .map(summary -> summaryResult(videoId, summaryLength, summary, false));
                            });
                });
    }

    /**
     * Raw hybrid search, for callers that want passages instead of an answer.
     *
     * @param k passages to return, default-k when null
     * @param vectorWeight dense weight, the configured hybrid weight when null
     */
    public Mono<List<String>> search(String videoId, String query, Integer k, Double vectorWeight) {
        CacheKey.requireVideoId(videoId);
        if (StringUtils.isBlank(query)) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        RepriseProperties.RetrievalConfig retrieval = properties.getRetrieval();
        return retrievalEngine.hybridSearch(videoId, query,
                k != null ? k : retrieval.getDefaultK(),
                vectorWeight != null ? vectorWeight : retrieval.getHybridVectorWeight());
    }

    private Flux<AnswerChunk> streamFromTranscript(String videoId, String question, SearchMethod method,
                                                   String model) {
        RepriseProperties.RetrievalConfig retrieval = properties.getRetrieval();

        return retrievalEngine.search(videoId, question, retrieval.getDefaultK(), method.vectorWeight(retrieval))
                .flatMapMany(result -> {
                    if (result.getPassages().isEmpty()) {
                        log.info("No transcript context for video {}, not calling the model", videoId);
                        return Flux.just(AnswerChunk.noContext());
                    }

                    log.info("Cache miss - streaming from {} with {} passages",
                            answerProvider.getName(), result.getPassages().size());
                    StringBuilder full = new StringBuilder();
                    return answerProvider.streamAnswer(question, result.getPassages(), model)
                            .doOnNext(full::append)
                            .map(AnswerChunk::token)
                            .concatWith(Mono.defer(() -> {
                                String answer = full.toString().strip();
                                if (answer.isEmpty()) {
                                    return Mono.error(new UpstreamUnavailableException(
                                            answerProvider.getName() + " streamed an empty answer"));
                                }
                                return store(videoId, question, answer)
                                        .map(stored -> AnswerChunk.complete(stored, false));
                            }));
                });
    }

    private Mono<QueryAnswer> answerFromTranscript(String videoId, String question, SearchMethod method,
                                                   String model) {
        RepriseProperties.RetrievalConfig retrieval = properties.getRetrieval();

        return retrievalEngine.search(videoId, question, retrieval.getDefaultK(), method.vectorWeight(retrieval))
                .flatMap(result -> {
                    if (result.getPassages().isEmpty()) {
                        log.info("No transcript context for video {}, not calling the model", videoId);
                        return Mono.just(QueryAnswer.noContext(videoId, result.isDegraded()));
                    }

                    log.info("Cache miss - asking {} with {} passages", answerProvider.getName(), result.getPassages().size());
                    return answerProvider.answer(question, result.getPassages(), model)
                            .flatMap(answer -> store(videoId, question, answer))
                            .map(answer -> QueryAnswer.builder()
                                    .videoId(videoId)
                                    .answer(answer)
                                    .contextAvailable(true)
                                    .cached(false)
                                    .retrievalDegraded(result.isDegraded())
                                    .build());
                });
    }

    private void validateQuestion(String videoId, String question) {
        CacheKey.requireVideoId(videoId);
        if (StringUtils.isBlank(question)) {
            throw new IllegalArgumentException("Query must not be blank");
        }
    }

    private Mono<Optional<TieredCacheManager.CacheResult>> lookup(String videoId, String query) {
        return Mono.fromCallable(() -> cacheManager.lookupResponse(videoId, query))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<String> store(String videoId, String query, String response) {
        return Mono.fromCallable(() -> {
            cacheManager.putResponse(videoId, query, response);
            return response;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private SummaryResult summaryResult(String videoId, SummaryLength length, String summary, boolean cached) {
        return SummaryResult.builder()
                .videoId(videoId)
                .length(length)
                .summary(summary)
                .cached(cached)
                .build();
    }
}
