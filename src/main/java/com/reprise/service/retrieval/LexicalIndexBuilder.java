package com.reprise.service.retrieval;

import com.reprise.config.RepriseProperties;
import com.reprise.model.Passage;
import com.reprise.model.RankedCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the per-video lexical indexes.
 *
 * Indexes are rebuilt wholesale, never patched. A search on a namespace without an index
 * builds one first from whatever passages are at hand.
 */
@Slf4j
@Service
public class LexicalIndexBuilder {

    private final Map<String, VideoNamespace> namespaces = new ConcurrentHashMap<>();
    private final RepriseProperties properties;

    public LexicalIndexBuilder(RepriseProperties properties) {
        this.properties = properties;
    }

    /**
     * Build an index over {@code passages} and make it the video's current one,
     * replacing any earlier passages and index.
     */
    public void ensureIndex(String videoId, List<Passage> passages) {
        Bm25Index index = build(passages);
        namespace(videoId).publish(passages, index);
        log.debug("Built lexical index for video {} over {} passages", videoId, index.size());
    }

    /**
     * Add passages to the video's namespace. The existing index is invalidated.
     */
    public void addPassages(String videoId, List<Passage> passages) {
        namespace(videoId).append(passages);
        log.debug("Added {} passages to video {}, index invalidated", passages.size(), videoId);
    }

    public List<RankedCandidate> search(String videoId, String query, int k) {
        return search(videoId, query, k, List.of());
    }

    /**
     * Top {@code k} passages for the query, best first. Equal scores keep insertion order.
     *
     * @param availablePassages used for a lazy build when the namespace has no passages yet
     * @return ranked passages; empty when the video has none
     */
    public List<RankedCandidate> search(String videoId, String query, int k, List<Passage> availablePassages) {
        VideoNamespace namespace = namespaces.get(videoId);
        if (namespace == null || namespace.snapshot().passages().isEmpty()) {
            if (availablePassages.isEmpty()) {
                return List.of();
            }
            ensureIndex(videoId, availablePassages);
            namespace = namespaces.get(videoId);
        }

        Bm25Index index = namespace.indexOrBuild(this::build);
        List<RankedCandidate> results = index.search(query, k);
        log.debug("Lexical search on video {} returned {} of {} passages", videoId, results.size(), index.size());
        return results;
    }

    public boolean hasIndex(String videoId) {
        VideoNamespace namespace = namespaces.get(videoId);
        return namespace != null && namespace.snapshot().index() != null;
    }

    public int passageCount(String videoId) {
        VideoNamespace namespace = namespaces.get(videoId);
        return namespace == null ? 0 : namespace.snapshot().passages().size();
    }

    private VideoNamespace namespace(String videoId) {
        return namespaces.computeIfAbsent(videoId, VideoNamespace::new);
    }

    private Bm25Index build(List<Passage> passages) {
        RepriseProperties.Bm25Config bm25 = properties.getRetrieval().getBm25();
        return new Bm25Index(passages, bm25.getK1(), bm25.getB());
    }
}
