package com.reprise.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.config.JacksonConfiguration;
import com.reprise.exception.MalformedRecordException;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheKey;
import com.reprise.model.CacheTier;
import com.reprise.model.TierLookup;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FileTierStore.
 */
class FileTierStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path baseDir;

    private ObjectMapper objectMapper;
    private FileTierStore store;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.createObjectMapper();
        store = new FileTierStore(baseDir, objectMapper);
    }

    @Test
    void testVideoStatusRoundTripsThroughFile() throws IOException {
        store.set(CacheEntry.videoProcessed("vid1", NOW));

        Path file = baseDir.resolve("videos").resolve("vid1.json");
        assertTrue(Files.exists(file));
        JsonNode json = objectMapper.readTree(file.toFile());
        assertEquals("vid1", json.get("video_id").asText());
        assertTrue(json.get("processed").asBoolean());

        TierLookup lookup = store.get(CacheKey.videoStatus("vid1"));
        assertTrue(lookup.isHit());
        assertEquals(NOW, lookup.getEntry().getCreatedAt());
        assertEquals(CacheTier.FILE, lookup.getEntry().getTierOfOrigin());
    }

    @Test
    void testQueryRecordIsSelfDescribing() throws IOException {
        CacheKey key = queryKey("vid1", "what is the main topic");
        store.set(CacheEntry.queryResponse(key, "what is the main topic", "R1", NOW));

        Path file = baseDir.resolve("queries").resolve("vid1_" + key.getFingerprint() + ".json");
        JsonNode json = objectMapper.readTree(file.toFile());
        assertEquals("vid1", json.get("video_id").asText());
        assertEquals("what is the main topic", json.get("query").asText());
        assertEquals("R1", json.get("response").asText());
        assertTrue(json.has("created_at"));

        TierLookup lookup = store.get(key);
        assertTrue(lookup.isHit());
        assertEquals("R1", lookup.getEntry().getResponse());
        assertEquals(key, lookup.getEntry().getKey());
    }

    @Test
    void testOverwriteIsLastWriteWins() {
        CacheKey key = queryKey("vid1", "q");
        store.set(CacheEntry.queryResponse(key, "q", "first", NOW));
        store.set(CacheEntry.queryResponse(key, "q", "second", NOW.plusSeconds(5)));

        assertEquals("second", store.get(key).getEntry().getResponse());
    }

    @Test
    void testMissingFileIsMiss() {
        TierLookup lookup = store.get(CacheKey.videoStatus("absent"));

        assertEquals(TierLookup.Status.MISS, lookup.getStatus());
        assertFalse(store.exists(CacheKey.videoStatus("absent")));
    }

    @Test
    void testCorruptFileIsErrorNotException() throws IOException {
        Files.writeString(baseDir.resolve("videos").resolve("vid1.json"), "{not json");

        TierLookup lookup = store.get(CacheKey.videoStatus("vid1"));

        assertTrue(lookup.isError());
        assertInstanceOf(MalformedRecordException.class, lookup.getError());
    }

    @Test
    void testIncompleteRecordIsError() throws IOException {
        Files.writeString(baseDir.resolve("videos").resolve("vid1.json"), "{\"video_id\":\"vid1\"}");

        assertTrue(store.get(CacheKey.videoStatus("vid1")).isError());
    }

    @Test
    void testWritesLeaveNoTempFiles() throws IOException {
        store.set(CacheEntry.videoProcessed("vid1", NOW));
        store.set(CacheEntry.videoProcessed("vid1", NOW.plusSeconds(1)));

        try (Stream<Path> files = Files.list(baseDir.resolve("videos"))) {
            assertEquals(List.of("vid1.json"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void testScanReturnsOnlyThatVideosRecords() throws IOException {
        store.set(CacheEntry.queryResponse(queryKey("ab", "one"), "one", "R1", NOW));
        store.set(CacheEntry.queryResponse(queryKey("ab", "two"), "two", "R2", NOW));
        store.set(CacheEntry.queryResponse(queryKey("ab_c", "three"), "three", "R3", NOW));
        Files.writeString(baseDir.resolve("queries").resolve("ab_notes.json"), "{}");

        List<TierLookup> records = store.scanQueryRecords("ab");

        assertEquals(2, records.size());
        assertTrue(records.stream().allMatch(TierLookup::isHit));
        assertEquals(2, records.stream().filter(r -> "ab".equals(r.getEntry().getVideoId())).count());
    }

    @Test
    void testScanReportsCorruptRecordAndContinues() throws IOException {
        CacheKey good = queryKey("vid1", "good");
        store.set(CacheEntry.queryResponse(good, "good", "R1", NOW));
        String badFingerprint = DigestUtils.sha256Hex("bad");
        Files.writeString(baseDir.resolve("queries").resolve("vid1_" + badFingerprint + ".json"), "garbage");

        List<TierLookup> records = store.scanQueryRecords("vid1");

        assertEquals(2, records.size());
        assertEquals(1, records.stream().filter(TierLookup::isHit).count());
        assertEquals(1, records.stream().filter(TierLookup::isError).count());
    }

    @Test
    void testScanOfUnknownVideoIsEmpty() {
        assertTrue(store.scanQueryRecords("nobody").isEmpty());
    }

    @Test
    void testPathTraversalVideoIdRejected() {
        assertThrows(IllegalArgumentException.class, () -> CacheKey.videoStatus("../etc"));
        assertThrows(IllegalArgumentException.class, () -> store.scanQueryRecords("../etc"));
    }

    private static CacheKey queryKey(String videoId, String normalizedQuery) {
        return CacheKey.queryResponse(videoId, DigestUtils.sha256Hex(normalizedQuery));
    }
}
