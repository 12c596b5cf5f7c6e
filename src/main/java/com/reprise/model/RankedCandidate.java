package com.reprise.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a ranked list produced by the dense or the lexical retrieval path.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedCandidate {

    private Passage passage;

    /**
     * Raw score in the producing system (cosine similarity or BM25), not comparable across lists.
     */
    private double sourceScore;

    /**
     * Zero-based position in the producing list.
     */
    private int rankPosition;

    public String getPassageText() {
        return passage != null ? passage.getText() : null;
    }
}
