package com.reprise.service.retrieval;

import com.reprise.model.Passage;
import com.reprise.model.RankedCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Bm25Index.
 */
class Bm25IndexTest {

    private static Passage passage(String id, String text) {
        return Passage.builder().id(id).text(text).build();
    }

    @Test
    void testMatchingPassageRanksFirst() {
        Bm25Index index = new Bm25Index(List.of(
                passage("p0", "the weather today is sunny"),
                passage("p1", "neural networks learn representations"),
                passage("p2", "cooking pasta takes ten minutes")
        ), 1.5, 0.75);

        List<RankedCandidate> results = index.search("how do neural networks learn", 3);

        assertEquals(3, results.size());
        assertEquals("p1", results.get(0).getPassage().getId());
        assertTrue(results.get(0).getSourceScore() > 0.0);
        assertEquals(0, results.get(0).getRankPosition());
    }

    @Test
    void testRareTermOutweighsCommonTerm() {
        Bm25Index index = new Bm25Index(List.of(
                passage("p0", "video about cats"),
                passage("p1", "video about dogs"),
                passage("p2", "video about quasars")
        ), 1.5, 0.75);

        List<RankedCandidate> results = index.search("video quasars", 1);

        assertEquals("p2", results.get(0).getPassage().getId());
    }

    @Test
    void testTiesKeepInsertionOrder() {
        Bm25Index index = new Bm25Index(List.of(
                passage("p0", "alpha"),
                passage("p1", "beta"),
                passage("p2", "gamma")
        ), 1.5, 0.75);

        List<RankedCandidate> results = index.search("nothing matches", 3);

        assertEquals(List.of("p0", "p1", "p2"),
                results.stream().map(r -> r.getPassage().getId()).toList());
        assertTrue(results.stream().allMatch(r -> r.getSourceScore() == 0.0));
    }

    @Test
    void testTopKLimitsResults() {
        Bm25Index index = new Bm25Index(List.of(
                passage("p0", "a b"),
                passage("p1", "a c"),
                passage("p2", "a d")
        ), 1.5, 0.75);

        assertEquals(2, index.search("a", 2).size());
        assertTrue(index.search("a", 0).isEmpty());
    }

    @Test
    void testSearchIsCaseInsensitive() {
        Bm25Index index = new Bm25Index(List.of(
                passage("p0", "Something else"),
                passage("p1", "The KUBERNETES scheduler")
        ), 1.5, 0.75);

        assertEquals("p1", index.search("kubernetes", 1).get(0).getPassage().getId());
    }

    @Test
    void testIdfIsNeverNegative() {
        Bm25Index index = new Bm25Index(List.of(
                passage("p0", "common"),
                passage("p1", "common"),
                passage("p2", "common rare")
        ), 1.5, 0.75);

        assertTrue(index.idf("common") > 0.0);
        assertTrue(index.idf("rare") > index.idf("common"));
    }

    @Test
    void testEmptyIndex() {
        Bm25Index index = new Bm25Index(List.of(), 1.5, 0.75);

        assertTrue(index.isEmpty());
        assertTrue(index.search("anything", 5).isEmpty());
    }
}
