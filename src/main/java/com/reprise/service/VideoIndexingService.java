package com.reprise.service;

import com.reprise.model.CacheKey;
import com.reprise.model.Passage;
import com.reprise.model.dto.IndexResult;
import com.reprise.provider.DenseSimilarityProvider;
import com.reprise.service.retrieval.LexicalIndexBuilder;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Indexes a video's transcript passages for retrieval.
 *
 * Flow:
 * 1. Skip if the video is already processed (unless forced)
 * 2. Upsert passages into the dense index
 * 3. Rebuild the lexical index
 * 4. Mark the video processed
 *
 * The video is only marked processed once both indexes hold its passages.
 */
@Slf4j
@Service
public class VideoIndexingService {

    private final TieredCacheManager cacheManager;
    private final DenseSimilarityProvider denseProvider;
    private final LexicalIndexBuilder lexicalIndex;

    public VideoIndexingService(TieredCacheManager cacheManager,
                                DenseSimilarityProvider denseProvider,
                                LexicalIndexBuilder lexicalIndex) {
        this.cacheManager = cacheManager;
        this.denseProvider = denseProvider;
        this.lexicalIndex = lexicalIndex;
    }

    /**
     * Index a transcript.
     *
     * @param videoId video id
     * @param passages chunked transcript, in transcript order
     * @param force re-index even if already processed
     * @return what was done
     */
    public Mono<IndexResult> indexTranscript(String videoId, List<Passage> passages, boolean force) {
        CacheKey.requireVideoId(videoId);
        if (passages == null || passages.isEmpty()) {
            throw new IllegalArgumentException("At least one passage is required");
        }
        List<Passage> prepared = assignIds(videoId, passages);

        return Mono.fromCallable(() -> !force && cacheManager.hasProcessed(videoId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(alreadyProcessed -> {
                    if (alreadyProcessed) {
                        log.info("Video {} already processed, skipping indexing", videoId);
                        return Mono.just(IndexResult.builder()
                                .videoId(videoId)
                                .indexed(false)
                                .passageCount(lexicalIndex.passageCount(videoId))
                                .build());
                    }
                    return index(videoId, prepared);
                });
    }

    /**
     * Whether the video has a valid processed marker.
     */
    public Mono<Boolean> isProcessed(String videoId) {
        CacheKey.requireVideoId(videoId);
        return Mono.fromCallable(() -> cacheManager.hasProcessed(videoId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<IndexResult> index(String videoId, List<Passage> passages) {
        return denseProvider.upsert(videoId, passages)
                .then(Mono.fromCallable(() -> {
                    lexicalIndex.ensureIndex(videoId, passages);
                    cacheManager.markProcessed(videoId);
                    return IndexResult.builder()
                            .videoId(videoId)
                            .indexed(true)
                            .passageCount(passages.size())
                            .build();
                }).subscribeOn(Schedulers.boundedElastic()))
                .doOnSuccess(result -> log.info("Indexed video {}: {} passages", videoId, result.getPassageCount()));
    }

    /**
     * Validate passages and give each an id; missing ids become {@code {videoId}-{ordinal}}.
     */
    List<Passage> assignIds(String videoId, List<Passage> passages) {
        List<Passage> prepared = new ArrayList<>(passages.size());
        for (int i = 0; i < passages.size(); i++) {
            Passage passage = passages.get(i);
            if (passage == null || StringUtils.isBlank(passage.getText())) {
                throw new IllegalArgumentException("Passage " + i + " has no text");
            }
            prepared.add(passage.toBuilder()
                    .id(StringUtils.isBlank(passage.getId()) ? videoId + "-" + i : passage.getId())
                    .metadata(passage.getMetadata() != null ? passage.getMetadata() : new HashMap<>())
                    .build());
        }
        return prepared;
    }
}
