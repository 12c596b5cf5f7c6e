package com.reprise.provider;

import com.reprise.config.RepriseProperties;
import com.reprise.exception.UpstreamUnavailableException;
import com.reprise.model.Passage;
import com.reprise.model.RankedCandidate;
import com.reprise.model.vector.QueryRequest;
import com.reprise.model.vector.QueryResponse;
import com.reprise.model.vector.UpsertRequest;
import com.reprise.model.vector.UpsertResponse;
import com.reprise.service.embedding.EmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense similarity search against a Pinecone index (data-plane REST API).
 *
 * One namespace per video. Passage text travels in the vector metadata under
 * {@value #TEXT_KEY}, so a query returns passages without a second lookup.
 */
@Slf4j
@Component
public class PineconeSimilarityProvider extends AbstractProvider implements DenseSimilarityProvider {

    static final String TEXT_KEY = "text";
    private static final String API_KEY_HEADER = "Api-Key";

    /**
     * Vectors per upsert request, as recommended for the REST API.
     */
    private static final int UPSERT_BATCH_SIZE = 100;

    private final EmbeddingService embeddingService;

    public PineconeSimilarityProvider(WebClient webClient,
                                      RepriseProperties properties,
                                      EmbeddingService embeddingService) {
        super(webClient, properties, "pinecone");
        this.embeddingService = embeddingService;
    }

    @Override
    public String getName() {
        return "pinecone";
    }

    @Override
    public Mono<List<RankedCandidate>> similaritySearch(String videoId, String query, int k) {
        return embeddingService.embed(query)
                .flatMap(vector -> query(videoId, vector, k))
                .map(this::toCandidates);
    }

    @Override
    public Mono<Integer> upsert(String videoId, List<Passage> passages) {
        if (passages.isEmpty()) {
            return Mono.just(0);
        }

        List<String> texts = passages.stream().map(Passage::getText).toList();
        return embeddingService.embedBatch(texts)
                .flatMap(vectors -> {
                    if (vectors.size() != passages.size()) {
                        return Mono.error(new UpstreamUnavailableException("Expected " + passages.size()
                                + " embeddings for video " + videoId + ", got " + vectors.size()));
                    }
                    List<Mono<Integer>> batches = new ArrayList<>();
                    for (int from = 0; from < passages.size(); from += UPSERT_BATCH_SIZE) {
                        int to = Math.min(from + UPSERT_BATCH_SIZE, passages.size());
                        batches.add(upsertBatch(videoId, passages.subList(from, to), vectors.subList(from, to)));
                    }
                    return Mono.zip(batches, counts -> {
                        int total = 0;
                        for (Object count : counts) {
                            total += (Integer) count;
                        }
                        return total;
                    });
                })
                .doOnSuccess(count -> log.info("Upserted {} vectors into namespace {}", count, videoId));
    }

    private Mono<QueryResponse> query(String videoId, List<Float> vector, int k) {
        QueryRequest request = QueryRequest.builder()
                .namespace(videoId)
                .vector(vector)
                .topK(k)
                .includeMetadata(true)
                .includeValues(false)
                .build();

        return executeWithRetry(Mono.defer(() -> webClient.post()
                .uri(config.getBaseUrl() + "/query")
                .header(API_KEY_HEADER, config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(QueryResponse.class)));
    }

    private Mono<Integer> upsertBatch(String videoId, List<Passage> passages, List<List<Float>> vectors) {
        List<UpsertRequest.Vector> payload = new ArrayList<>(passages.size());
        for (int i = 0; i < passages.size(); i++) {
            Passage passage = passages.get(i);
            Map<String, Object> metadata = new HashMap<>();
            if (passage.getMetadata() != null) {
                metadata.putAll(passage.getMetadata());
            }
            metadata.put(TEXT_KEY, passage.getText());
            payload.add(UpsertRequest.Vector.builder()
                    .id(passage.getId())
                    .values(vectors.get(i))
                    .metadata(metadata)
                    .build());
        }

        UpsertRequest request = UpsertRequest.builder()
                .namespace(videoId)
                .vectors(payload)
                .build();

        return executeWithRetry(Mono.defer(() -> webClient.post()
                        .uri(config.getBaseUrl() + "/vectors/upsert")
                        .header(API_KEY_HEADER, config.getApiKey())
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(request)
                        .retrieve()
                        .bodyToMono(UpsertResponse.class)))
                .map(UpsertResponse::getUpsertedCount)
                .switchIfEmpty(Mono.error(new UpstreamUnavailableException("Empty upsert response from Pinecone")));
    }

    private List<RankedCandidate> toCandidates(QueryResponse response) {
        if (response.getMatches() == null) {
            return List.of();
        }

        List<RankedCandidate> candidates = new ArrayList<>(response.getMatches().size());
        for (QueryResponse.Match match : response.getMatches()) {
            Map<String, Object> metadata = match.getMetadata() != null ? new HashMap<>(match.getMetadata()) : new HashMap<>();
            Object text = metadata.remove(TEXT_KEY);
            if (!(text instanceof String)) {
                log.warn("Pinecone match {} has no passage text, skipping", match.getId());
                continue;
            }
            candidates.add(RankedCandidate.builder()
                    .passage(Passage.builder()
                            .id(match.getId())
                            .text((String) text)
                            .metadata(metadata)
                            .build())
                    .sourceScore(match.getScore())
                    .rankPosition(candidates.size())
                    .build());
        }
        return candidates;
    }
}
