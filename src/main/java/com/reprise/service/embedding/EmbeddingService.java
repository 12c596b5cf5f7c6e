package com.reprise.service.embedding;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Embeds questions and transcript passages for the dense index.
 * Questions and passages must go through the same model, or similarity scores are meaningless.
 */
public interface EmbeddingService {

    /**
     * @param text question or passage text
     * @return embedding vector
     */
    Mono<List<Float>> embed(String text);

    /**
     * Embed a whole transcript. Implementations split large inputs into several requests.
     *
     * @param texts input texts
     * @return one vector per input, in input order
     */
    Mono<List<List<Float>>> embedBatch(List<String> texts);

    /**
     * Get model name/identifier.
     */
    String modelName();

    /**
     * Whether credentials and an endpoint are configured.
     */
    boolean isReady();
}
