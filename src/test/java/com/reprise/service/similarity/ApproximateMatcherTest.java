package com.reprise.service.similarity;

import com.reprise.config.JacksonConfiguration;
import com.reprise.config.RepriseProperties;
import com.reprise.exception.StorageUnavailableException;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheKey;
import com.reprise.model.CacheTier;
import com.reprise.repository.FileTierStore;
import com.reprise.service.canonicalization.QueryNormalizer;
import com.reprise.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for ApproximateMatcher.
 */
class ApproximateMatcherTest {

    @TempDir
    Path baseDir;

    private MutableClock clock;
    private QueryNormalizer normalizer;
    private RepriseProperties properties;
    private FileTierStore fileStore;
    private ApproximateMatcher matcher;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        normalizer = new QueryNormalizer();
        properties = new RepriseProperties();
        fileStore = new FileTierStore(baseDir, JacksonConfiguration.createObjectMapper());
        matcher = new ApproximateMatcher(fileStore, normalizer, properties, clock);
    }

    @Test
    void testParaphraseAboveThresholdMatches() {
        record("vid1", "what is the main topic", "R1", clock.instant());

        Optional<ApproximateMatcher.SimilarMatch> match = matcher.findSimilar("vid1", "what is main topic");

        assertTrue(match.isPresent());
        assertEquals("R1", match.get().getEntry().getResponse());
        assertEquals(0.8, match.get().getScore(), 1e-9);
    }

    @Test
    void testUnrelatedQuestionDoesNotMatch() {
        record("vid1", "what is the main topic", "R1", clock.instant());

        assertTrue(matcher.findSimilar("vid1", "unrelated question about pricing").isEmpty());
    }

    @Test
    void testScoreExactlyAtThresholdDoesNotMatch() {
        record("vid1", "alpha beta gamma", "R1", clock.instant());

        // intersection {alpha, beta} = 2, union {alpha, beta, gamma, delta} = 4
        assertTrue(matcher.findSimilar("vid1", "alpha beta delta").isEmpty());
    }

    @Test
    void testSummaryRecordsNeverMatchApproximately() {
        record("vid1", "summarize medium", "Cached summary", clock.instant());

        // 2 of 3 tokens shared, but a question must not receive a summary
        assertTrue(matcher.findSimilar("vid1", "summarize the medium").isEmpty());
    }

    @Test
    void testSummaryLookupDoesNotMatchQuestions() {
        record("vid1", "please summarize short", "Question answer", clock.instant());

        assertTrue(matcher.findSimilar("vid1", "summarize short").isEmpty());
    }

    @Test
    void testOtherVideosRecordsAreIgnored() {
        record("vid2", "what is the main topic", "R2", clock.instant());

        assertTrue(matcher.findSimilar("vid1", "what is the main topic").isEmpty());
    }

    @Test
    void testExpiredRecordsAreExcluded() {
        record("vid1", "what is the main topic", "old", clock.instant().minus(Duration.ofHours(25)));

        assertTrue(matcher.findSimilar("vid1", "what is main topic").isEmpty());
    }

    @Test
    void testBestCandidateWins() {
        record("vid1", "how does the engine start", "engine", clock.instant());
        record("vid1", "what is the main topic of the talk", "topic", clock.instant());

        Optional<ApproximateMatcher.SimilarMatch> match = matcher.findSimilar("vid1", "what is the main topic of this talk");

        assertTrue(match.isPresent());
        assertEquals("topic", match.get().getEntry().getResponse());
    }

    @Test
    void testTiesFavourMostRecentRecord() {
        record("vid1", "main topic alpha", "older", clock.instant().minus(Duration.ofHours(2)));
        record("vid1", "main topic beta", "newer", clock.instant().minus(Duration.ofHours(1)));

        // Both score 2/3 against "main topic"
        Optional<ApproximateMatcher.SimilarMatch> match = matcher.findSimilar("vid1", "main topic");

        assertTrue(match.isPresent());
        assertEquals("newer", match.get().getEntry().getResponse());
    }

    @Test
    void testEmptyQueryNeverMatches() {
        record("vid1", "anything", "R1", clock.instant());

        assertTrue(matcher.findSimilar("vid1", "").isEmpty());
    }

    @Test
    void testCorruptRecordIsSkipped() throws IOException {
        record("vid1", "what is the main topic", "R1", clock.instant());
        Files.writeString(baseDir.resolve("queries").resolve("vid1_" + "0".repeat(64) + ".json"), "{broken");

        Optional<ApproximateMatcher.SimilarMatch> match = matcher.findSimilar("vid1", "what is main topic");

        assertTrue(match.isPresent());
        assertEquals("R1", match.get().getEntry().getResponse());
    }

    @Test
    void testScanFailureReportsNoMatch() {
        FileTierStore failing = mock(FileTierStore.class);
        when(failing.scanQueryRecords(anyString()))
                .thenThrow(new StorageUnavailableException(CacheTier.FILE, "disk gone", null));
        ApproximateMatcher failingMatcher = new ApproximateMatcher(failing, normalizer, properties, clock);

        assertTrue(failingMatcher.findSimilar("vid1", "what is main topic").isEmpty());
    }

    @Test
    void testJaccard() {
        assertEquals(1.0, ApproximateMatcher.jaccard(Set.of("a", "b"), Set.of("a", "b")), 1e-9);
        assertEquals(0.0, ApproximateMatcher.jaccard(Set.of("a"), Set.of("b")), 1e-9);
        assertEquals(1.0 / 3.0, ApproximateMatcher.jaccard(Set.of("a", "b"), Set.of("a", "c")), 1e-9);
    }

    private void record(String videoId, String query, String response, Instant createdAt) {
        String normalized = normalizer.normalize(query);
        CacheKey key = CacheKey.queryResponse(videoId, normalizer.fingerprint(normalized));
        fileStore.set(CacheEntry.queryResponse(key, normalized, response, createdAt));
    }
}
