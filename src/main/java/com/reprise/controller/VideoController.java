package com.reprise.controller;

import com.reprise.model.CacheHeaders;
import com.reprise.model.CacheKey;
import com.reprise.model.SummaryLength;
import com.reprise.model.dto.AnswerChunk;
import com.reprise.model.dto.IndexResult;
import com.reprise.model.dto.QueryAnswer;
import com.reprise.model.dto.QueryRequest;
import com.reprise.model.dto.SearchRequest;
import com.reprise.model.dto.SummaryRequest;
import com.reprise.model.dto.SummaryResult;
import com.reprise.model.dto.TranscriptRequest;
import com.reprise.service.TieredCacheManager;
import com.reprise.service.VideoIndexingService;
import com.reprise.service.VideoQueryService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Video transcript indexing, question answering and summarization, with cache provenance headers.
 */
@Slf4j
@RestController
@RequestMapping("/v1/videos/{videoId}")
public class VideoController {

    private final VideoIndexingService indexingService;
    private final VideoQueryService queryService;

    public VideoController(VideoIndexingService indexingService, VideoQueryService queryService) {
        this.indexingService = indexingService;
        this.queryService = queryService;
    }

    /**
     * Index already-chunked transcript passages.
     */
    @PostMapping(value = "/transcript", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IndexResult> indexTranscript(@PathVariable String videoId,
                                             @RequestBody TranscriptRequest request) {
        log.info("Received transcript for video {}: {} passages, force={}",
                videoId, request.getPassages() == null ? 0 : request.getPassages().size(), request.isForce());

        if (!CacheKey.isValidVideoId(videoId)) {
            return Mono.error(new IllegalArgumentException("Invalid video id: " + videoId));
        }
        if (request.getPassages() == null || request.getPassages().isEmpty()) {
            return Mono.error(new IllegalArgumentException("Passages cannot be empty"));
        }

        return Mono.defer(() -> indexingService.indexTranscript(videoId, request.getPassages(), request.isForce()));
    }

    /**
     * Whether the video is indexed and its processed marker is still valid.
     */
    @GetMapping("/status")
    public Mono<Map<String, Object>> getStatus(@PathVariable String videoId) {
        if (!CacheKey.isValidVideoId(videoId)) {
            return Mono.error(new IllegalArgumentException("Invalid video id: " + videoId));
        }
        return indexingService.isProcessed(videoId)
                .map(processed -> Map.of("videoId", videoId, "processed", processed));
    }

    /**
     * Answer a question about the video.
     */
    @PostMapping(value = "/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<QueryAnswer>> query(@PathVariable String videoId,
                                                   @RequestBody QueryRequest request) {
        log.info("Received query for video {}, method={}", videoId, request.getSearchMethod());

        if (!CacheKey.isValidVideoId(videoId)) {
            return Mono.error(new IllegalArgumentException("Invalid video id: " + videoId));
        }
        if (StringUtils.isBlank(request.getQuery())) {
            return Mono.error(new IllegalArgumentException("Query cannot be empty"));
        }

        return Mono.defer(() -> queryService.query(videoId, request.getQuery(),
                        request.getSearchMethod(), StringUtils.trimToNull(request.getModel())))
                .map(answer -> ResponseEntity.ok()
                        .headers(provenanceHeaders(answer))
                        .body(answer));
    }

    /**
     * Answer a question as server-sent events: "token" pieces, then one "done" event carrying
     * the full answer. A failure after the stream has started ends it with an "error" event.
     */
    @PostMapping(value = "/query/stream", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<AnswerChunk>> streamQuery(@PathVariable String videoId,
                                                          @RequestBody QueryRequest request) {
        log.info("Received streaming query for video {}, method={}", videoId, request.getSearchMethod());

        if (!CacheKey.isValidVideoId(videoId)) {
            return Flux.error(new IllegalArgumentException("Invalid video id: " + videoId));
        }
        if (StringUtils.isBlank(request.getQuery())) {
            return Flux.error(new IllegalArgumentException("Query cannot be empty"));
        }

        return Flux.defer(() -> queryService.streamQuery(videoId, request.getQuery(),
                        request.getSearchMethod(), StringUtils.trimToNull(request.getModel())))
                .map(chunk -> ServerSentEvent.builder(chunk)
                        .event(chunk.isComplete() ? "done" : "token")
                        .build())
                .onErrorResume(error -> {
                    log.error("Streaming query for video {} failed: {}", videoId, error.getMessage());
                    return Flux.just(ServerSentEvent.builder(AnswerChunk.failed(error.getMessage()))
                            .event("error")
                            .build());
                });
    }

    /**
     * Summarize the video. Length defaults to medium.
     */
    @PostMapping("/summary")
    public Mono<SummaryResult> summarize(@PathVariable String videoId,
                                         @RequestBody(required = false) SummaryRequest request) {
        SummaryLength length = request != null && request.getLength() != null
                ? request.getLength()
                : SummaryLength.MEDIUM;
        log.info("Received {} summary request for video {}", length, videoId);

        if (!CacheKey.isValidVideoId(videoId)) {
            return Mono.error(new IllegalArgumentException("Invalid video id: " + videoId));
        }

        return Mono.defer(() -> queryService.summarize(videoId, length));
    }

    /**
     * Hybrid passage search without answering.
     */
    @PostMapping(value = "/search", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<String>> search(@PathVariable String videoId,
                                     @RequestBody SearchRequest request) {
        if (!CacheKey.isValidVideoId(videoId)) {
            return Mono.error(new IllegalArgumentException("Invalid video id: " + videoId));
        }
        if (StringUtils.isBlank(request.getQuery())) {
            return Mono.error(new IllegalArgumentException("Query cannot be empty"));
        }
        if (request.getK() != null && request.getK() < 1) {
            return Mono.error(new IllegalArgumentException("k must be at least 1"));
        }
        if (request.getVectorWeight() != null
                && (request.getVectorWeight() < 0.0 || request.getVectorWeight() > 1.0)) {
            return Mono.error(new IllegalArgumentException("vectorWeight must be within [0, 1]"));
        }

        return Mono.defer(() -> queryService.search(videoId, request.getQuery(),
                request.getK(), request.getVectorWeight()));
    }

    static HttpHeaders provenanceHeaders(QueryAnswer answer) {
        HttpHeaders headers = new HttpHeaders();
        TieredCacheManager.CacheResult result = answer.getCacheResult();

        headers.add(CacheHeaders.CACHE_HIT, String.valueOf(answer.isCached()));
        if (result == null) {
            headers.add(CacheHeaders.CACHE_MATCH, "none");
        } else {
            headers.add(CacheHeaders.CACHE_MATCH, result.getMatchType().name().toLowerCase(Locale.ROOT));
            headers.add(CacheHeaders.CACHE_SCORE, String.format(Locale.ROOT, "%.3f", result.getScore()));
            headers.add(CacheHeaders.CACHE_TIER, result.getTier().name().toLowerCase(Locale.ROOT));
            if (result.getAge() != null) {
                headers.add(CacheHeaders.CACHE_AGE, String.valueOf(result.getAge().getSeconds()));
            }
        }

        if (answer.isRetrievalDegraded()) {
            headers.add(CacheHeaders.RETRIEVAL_DEGRADED, "true");
        }
        return headers;
    }
}
