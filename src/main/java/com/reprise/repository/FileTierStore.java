package com.reprise.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.exception.MalformedRecordException;
import com.reprise.exception.StorageUnavailableException;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheKey;
import com.reprise.model.CacheTier;
import com.reprise.model.EntityKind;
import com.reprise.model.QueryRecord;
import com.reprise.model.TierLookup;
import com.reprise.model.VideoStatusRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Durable flat-file tier: one JSON record per entity.
 * <ul>
 *   <li>{@code videos/{videoId}.json} holds a {@link VideoStatusRecord}</li>
 *   <li>{@code queries/{videoId}_{fingerprint}.json} holds a {@link QueryRecord}</li>
 * </ul>
 * Writes go to a temp file that is then moved over the target, so readers never see half a record.
 */
@Slf4j
public class FileTierStore implements TierStore {

    private static final String VIDEOS_DIR = "videos";
    private static final String QUERIES_DIR = "queries";
    private static final String SUFFIX = ".json";

    private final Path videosDir;
    private final Path queriesDir;
    private final ObjectMapper objectMapper;

    public FileTierStore(Path baseDir, ObjectMapper objectMapper) {
        this.videosDir = baseDir.resolve(VIDEOS_DIR);
        this.queriesDir = baseDir.resolve(QUERIES_DIR);
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(videosDir);
            Files.createDirectories(queriesDir);
        } catch (IOException e) {
            // Retried on every write
            log.warn("Could not create cache directories under {}", baseDir, e);
        }
    }

    @Override
    public CacheTier tier() {
        return CacheTier.FILE;
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    @Override
    public TierLookup get(CacheKey key) {
        Path path = pathFor(key);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            log.debug("File tier miss: {}", key);
            return TierLookup.miss();
        } catch (IOException e) {
            return TierLookup.error(new StorageUnavailableException(CacheTier.FILE,
                    "Error reading cache file " + path, e));
        }

        try {
            CacheEntry entry = key.getKind() == EntityKind.VIDEO_STATUS
                    ? parseVideoStatus(key, bytes)
                    : parseQueryRecord(key, bytes);
            log.debug("File tier hit: {}", key);
            return TierLookup.hit(entry);
        } catch (MalformedRecordException e) {
            return TierLookup.error(e);
        }
    }

    @Override
    public void set(CacheEntry entry) {
        CacheKey key = entry.getKey();
        Object record;
        if (key.getKind() == EntityKind.VIDEO_STATUS) {
            record = VideoStatusRecord.builder()
                    .videoId(entry.getVideoId())
                    .processed(entry.getProcessed())
                    .createdAt(entry.getCreatedAt())
                    .build();
        } else {
            record = QueryRecord.builder()
                    .videoId(entry.getVideoId())
                    .query(entry.getQueryText())
                    .response(entry.getResponse())
                    .createdAt(entry.getCreatedAt())
                    .build();
        }

        Path target = pathFor(key);
        try {
            writeAtomically(target, objectMapper.writeValueAsBytes(record));
            log.debug("Stored in file tier: {}", target);
        } catch (IOException e) {
            throw new StorageUnavailableException(CacheTier.FILE, "Error writing cache file " + target, e);
        }
    }

    @Override
    public boolean exists(CacheKey key) {
        return Files.exists(pathFor(key));
    }

    /**
     * Read every stored query record of one video, expired ones included.
     * A record that cannot be read or parsed comes back as an error element; the rest of the
     * scan continues.
     *
     * @param videoId video id
     * @return one lookup per record file
     * @throws StorageUnavailableException if the directory itself cannot be listed
     */
    public List<TierLookup> scanQueryRecords(String videoId) {
        CacheKey.requireVideoId(videoId);
        if (!Files.isDirectory(queriesDir)) {
            return List.of();
        }

        Pattern fileName = Pattern.compile(Pattern.quote(videoId) + "_([0-9a-f]{64})" + Pattern.quote(SUFFIX));
        List<TierLookup> results = new ArrayList<>();

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(queriesDir, videoId + "_*" + SUFFIX)) {
            for (Path path : stream) {
                Matcher matcher = fileName.matcher(path.getFileName().toString());
                if (!matcher.matches()) {
                    continue;
                }
                results.add(readQueryFile(CacheKey.queryResponse(videoId, matcher.group(1)), path));
            }
        } catch (IOException e) {
            throw new StorageUnavailableException(CacheTier.FILE, "Error listing query records for " + videoId, e);
        }
        return results;
    }

    private TierLookup readQueryFile(CacheKey key, Path path) {
        try {
            return TierLookup.hit(parseQueryRecord(key, Files.readAllBytes(path)));
        } catch (IOException e) {
            return TierLookup.error(new StorageUnavailableException(CacheTier.FILE,
                    "Error reading cache file " + path, e));
        } catch (MalformedRecordException e) {
            return TierLookup.error(e);
        }
    }

    private CacheEntry parseVideoStatus(CacheKey key, byte[] bytes) throws MalformedRecordException {
        VideoStatusRecord record;
        try {
            record = objectMapper.readValue(bytes, VideoStatusRecord.class);
        } catch (IOException e) {
            throw new MalformedRecordException("Unparseable video status record for " + key, e);
        }
        if (record.getCreatedAt() == null || record.getProcessed() == null) {
            throw new MalformedRecordException("Incomplete video status record for " + key);
        }
        return CacheEntry.builder()
                .kind(EntityKind.VIDEO_STATUS)
                .videoId(key.getVideoId())
                .processed(record.getProcessed())
                .createdAt(record.getCreatedAt())
                .tierOfOrigin(CacheTier.FILE)
                .build();
    }

    private CacheEntry parseQueryRecord(CacheKey key, byte[] bytes) throws MalformedRecordException {
        QueryRecord record;
        try {
            record = objectMapper.readValue(bytes, QueryRecord.class);
        } catch (IOException e) {
            throw new MalformedRecordException("Unparseable query record for " + key, e);
        }
        if (record.getCreatedAt() == null || record.getResponse() == null || record.getQuery() == null) {
            throw new MalformedRecordException("Incomplete query record for " + key);
        }
        if (record.getVideoId() != null && !record.getVideoId().equals(key.getVideoId())) {
            throw new MalformedRecordException("Query record " + key + " belongs to video " + record.getVideoId());
        }
        return CacheEntry.builder()
                .kind(EntityKind.QUERY_RESPONSE)
                .videoId(key.getVideoId())
                .fingerprint(key.getFingerprint())
                .queryText(record.getQuery())
                .response(record.getResponse())
                .createdAt(record.getCreatedAt())
                .tierOfOrigin(CacheTier.FILE)
                .build();
    }

    private Path pathFor(CacheKey key) {
        if (key.getKind() == EntityKind.VIDEO_STATUS) {
            return videosDir.resolve(key.getVideoId() + SUFFIX);
        }
        return queriesDir.resolve(key.getVideoId() + "_" + key.getFingerprint() + SUFFIX);
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path dir = target.getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
