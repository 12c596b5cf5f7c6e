package com.reprise.service.embedding;

import com.reprise.config.RepriseProperties;
import com.reprise.exception.UpstreamUnavailableException;
import com.reprise.model.EmbeddingRequest;
import com.reprise.model.EmbeddingResponse;
import com.reprise.provider.AbstractProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Embeddings through the OpenAI {@code /embeddings} endpoint.
 */
@Slf4j
@Service
public class OpenAiEmbeddingService extends AbstractProvider implements EmbeddingService {

    /**
     * Inputs per request. The API accepts up to 2048.
     */
    private static final int BATCH_SIZE = 256;

    public OpenAiEmbeddingService(WebClient webClient, RepriseProperties properties) {
        super(webClient, properties, "openai");
    }

    @Override
    public String getName() {
        return "openai-embeddings";
    }

    @Override
    public Mono<List<Float>> embed(String text) {
        return embedBatch(List.of(text)).map(vectors -> vectors.get(0));
    }

    @Override
    public Mono<List<List<Float>>> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return Mono.just(List.of());
        }

        List<Mono<List<List<Float>>>> batches = new ArrayList<>();
        for (int from = 0; from < texts.size(); from += BATCH_SIZE) {
            batches.add(requestBatch(texts.subList(from, Math.min(from + BATCH_SIZE, texts.size()))));
        }

        return Mono.zip(batches, results -> {
            List<List<Float>> all = new ArrayList<>(texts.size());
            for (Object result : results) {
                @SuppressWarnings("unchecked")
                List<List<Float>> batch = (List<List<Float>>) result;
                all.addAll(batch);
            }
            return all;
        });
    }

    @Override
    public String modelName() {
        return config != null ? config.getEmbeddingModel() : null;
    }

    @Override
    public boolean isReady() {
        return isEnabled();
    }

    private Mono<List<List<Float>>> requestBatch(List<String> texts) {
        EmbeddingRequest request = EmbeddingRequest.builder()
                .model(modelName())
                .input(texts)
                .build();

        log.debug("Requesting {} embeddings from OpenAI: model={}", texts.size(), request.getModel());

        Mono<EmbeddingResponse> responseMono = Mono.defer(() -> webClient.post()
                .uri(config.getBaseUrl() + "/embeddings")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(EmbeddingResponse.class));

        return executeWithRetry(responseMono)
                .flatMap(response -> toVectors(response, texts.size()));
    }

    private Mono<List<List<Float>>> toVectors(EmbeddingResponse response, int expected) {
        if (response.getData() == null || response.getData().size() != expected) {
            return Mono.error(new UpstreamUnavailableException(
                    "Expected " + expected + " embeddings, got "
                            + (response.getData() == null ? 0 : response.getData().size())));
        }
        List<List<Float>> vectors = new ArrayList<>(expected);
        response.getData().stream()
                .sorted(Comparator.comparingInt(EmbeddingResponse.EmbeddingData::getIndex))
                .forEach(data -> vectors.add(data.getEmbedding()));
        return Mono.just(vectors);
    }
}
