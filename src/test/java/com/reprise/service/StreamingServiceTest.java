package com.reprise.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StreamingService.
 */
class StreamingServiceTest {

    @Test
    void testSplitPrefersWordBoundaries() {
        assertEquals(List.of("Consensus ", "is hard."), StreamingService.split("Consensus is hard."));
        assertEquals(List.of("Raft ele", "cts a le", "ader by ", "vote."),
                StreamingService.split("Raft elects a leader by vote."));
    }

    @Test
    void testSplitShortAndEmptyAnswers() {
        assertEquals(List.of("Yes."), StreamingService.split("Yes."));
        assertTrue(StreamingService.split("").isEmpty());
        assertTrue(StreamingService.split(null).isEmpty());
    }

    @Test
    void testReplayEmitsEveryPieceInOrder() {
        String answer = "A consensus protocol for replicated logs.";

        List<String> replayed = new StreamingService().replay(answer).collectList().block();

        assertNotNull(replayed);
        assertEquals(StreamingService.split(answer), replayed);
        assertEquals(answer, String.join("", replayed));
    }
}
