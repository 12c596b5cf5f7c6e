package com.reprise.service.retrieval;

import com.reprise.model.RankedCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted fusion of a dense and a lexical ranking.
 *
 * Each list is normalized by position: item i of a list of length N scores 1 - i/N.
 * Raw scores are ignored, so cosine similarities and BM25 scores combine without calibration.
 *
 * fused = dense * vectorWeight + lexical * (1 - vectorWeight)
 */
@Slf4j
@Component
public class ScoreFusion {

    /**
     * @param dense dense candidates, best first
     * @param lexical lexical candidates, best first
     * @param vectorWeight weight of the dense side, in [0, 1]
     * @param k maximum results
     * @return passage texts, best first; ties keep discovery order (dense list, then lexical-only)
     */
    public List<String> fuse(List<RankedCandidate> dense, List<RankedCandidate> lexical, double vectorWeight, int k) {
        if (vectorWeight < 0.0 || vectorWeight > 1.0) {
            throw new IllegalArgumentException("vectorWeight must be within [0, 1]: " + vectorWeight);
        }

        Map<String, Double> denseScores = normalizeByPosition(dense);
        Map<String, Double> lexicalScores = normalizeByPosition(lexical);

        // Insertion order is discovery order
        Map<String, Double> fused = new LinkedHashMap<>();
        for (String text : denseScores.keySet()) {
            fused.put(text, 0.0);
        }
        for (String text : lexicalScores.keySet()) {
            fused.putIfAbsent(text, 0.0);
        }

        List<Map.Entry<String, Double>> ranked = new ArrayList<>();
        for (String text : fused.keySet()) {
            double score = denseScores.getOrDefault(text, 0.0) * vectorWeight
                    + lexicalScores.getOrDefault(text, 0.0) * (1.0 - vectorWeight);
            // Zero means the passage only appeared on a zero-weighted side
            if (score > 0.0) {
                ranked.add(Map.entry(text, score));
            }
        }
        ranked.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));

        List<String> results = new ArrayList<>(Math.min(k, ranked.size()));
        for (Map.Entry<String, Double> entry : ranked) {
            if (results.size() >= k) {
                break;
            }
            results.add(entry.getKey());
        }

        log.debug("Fused {} dense + {} lexical candidates into {} (weight={})",
                dense.size(), lexical.size(), results.size(), vectorWeight);
        return results;
    }

    /**
     * Position scores keyed by passage text. A text repeated within one list keeps its first score.
     */
    static Map<String, Double> normalizeByPosition(List<RankedCandidate> candidates) {
        Map<String, Double> scores = new LinkedHashMap<>();
        int n = candidates.size();
        for (int i = 0; i < n; i++) {
            String text = candidates.get(i).getPassageText();
            if (text == null) {
                continue;
            }
            scores.putIfAbsent(text, 1.0 - (double) i / n);
        }
        return scores;
    }
}
