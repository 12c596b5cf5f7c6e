package com.reprise.service.retrieval;

import com.reprise.model.Passage;
import com.reprise.model.RankedCandidate;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable Okapi BM25 index over one video's passages.
 *
 * score(D, Q) = sum over q in Q of idf(q) * tf(q, D) * (k1 + 1) / (tf(q, D) + k1 * (1 - b + b * |D| / avgdl))
 * idf(q) = ln(1 + (N - n(q) + 0.5) / (n(q) + 0.5))
 *
 * Built once, never modified. Rebuilding means constructing a new instance.
 */
public final class Bm25Index {

    private final List<Passage> passages;
    private final List<Map<String, Integer>> termFrequencies;
    private final int[] lengths;
    private final Map<String, Integer> documentFrequencies;
    private final double averageLength;
    private final double k1;
    private final double b;

    public Bm25Index(List<Passage> passages, double k1, double b) {
        this.passages = List.copyOf(passages);
        this.k1 = k1;
        this.b = b;
        this.lengths = new int[this.passages.size()];

        List<Map<String, Integer>> tfs = new ArrayList<>(this.passages.size());
        Map<String, Integer> dfs = new HashMap<>();
        long totalLength = 0;

        for (int i = 0; i < this.passages.size(); i++) {
            List<String> tokens = tokenize(this.passages.get(i).getText());
            Map<String, Integer> tf = new HashMap<>();
            for (String token : tokens) {
                tf.merge(token, 1, Integer::sum);
            }
            for (String term : tf.keySet()) {
                dfs.merge(term, 1, Integer::sum);
            }
            tfs.add(Collections.unmodifiableMap(tf));
            lengths[i] = tokens.size();
            totalLength += tokens.size();
        }

        this.termFrequencies = Collections.unmodifiableList(tfs);
        this.documentFrequencies = Collections.unmodifiableMap(dfs);
        this.averageLength = this.passages.isEmpty() ? 0.0 : (double) totalLength / this.passages.size();
    }

    /**
     * Lower-cased whitespace tokens.
     */
    public static List<String> tokenize(String text) {
        if (text == null) {
            return List.of();
        }
        return List.of(StringUtils.split(text.toLowerCase(Locale.ROOT)));
    }

    public int size() {
        return passages.size();
    }

    public boolean isEmpty() {
        return passages.isEmpty();
    }

    public List<Passage> getPassages() {
        return passages;
    }

    /**
     * Score every passage and return the best {@code k}, highest first.
     * Equal scores keep insertion order.
     */
    public List<RankedCandidate> search(String query, int k) {
        if (passages.isEmpty() || k <= 0) {
            return List.of();
        }

        List<String> queryTokens = tokenize(query);
        List<Scored> scored = new ArrayList<>(passages.size());
        for (int i = 0; i < passages.size(); i++) {
            scored.add(new Scored(i, score(i, queryTokens)));
        }
        // List.sort is stable
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());

        int limit = Math.min(k, scored.size());
        List<RankedCandidate> results = new ArrayList<>(limit);
        for (int rank = 0; rank < limit; rank++) {
            Scored s = scored.get(rank);
            results.add(RankedCandidate.builder()
                    .passage(passages.get(s.index()))
                    .sourceScore(s.score())
                    .rankPosition(rank)
                    .build());
        }
        return results;
    }

    double score(int doc, List<String> queryTokens) {
        Map<String, Integer> tf = termFrequencies.get(doc);
        double lengthNorm = averageLength == 0.0 ? 0.0 : lengths[doc] / averageLength;

        double sum = 0.0;
        for (String term : queryTokens) {
            Integer freq = tf.get(term);
            if (freq == null) {
                continue;
            }
            double denom = freq + k1 * (1.0 - b + b * lengthNorm);
            sum += idf(term) * (freq * (k1 + 1.0)) / denom;
        }
        return sum;
    }

    double idf(String term) {
        int n = documentFrequencies.getOrDefault(term, 0);
        int total = passages.size();
        return Math.log(1.0 + (total - n + 0.5) / (n + 0.5));
    }

    private record Scored(int index, double score) {
    }
}
