package com.reprise.provider;

import com.reprise.model.Passage;
import com.reprise.model.RankedCandidate;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Vector index holding passage embeddings, one namespace per video.
 */
public interface DenseSimilarityProvider {

    /**
     * Get provider name (e.g., "pinecone").
     */
    String getName();

    /**
     * Nearest passages to the query within the video's namespace.
     *
     * @param videoId namespace
     * @param query question text
     * @param k maximum results
     * @return candidates ordered best first
     */
    Mono<List<RankedCandidate>> similaritySearch(String videoId, String query, int k);

    /**
     * Embed and store passages in the video's namespace. Passages with an existing id are replaced.
     *
     * @return number of vectors written
     */
    Mono<Integer> upsert(String videoId, List<Passage> passages);

    /**
     * Check if provider is enabled and configured.
     */
    boolean isEnabled();
}
