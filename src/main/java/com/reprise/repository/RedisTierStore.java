package com.reprise.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.config.RepriseProperties;
import com.reprise.exception.MalformedRecordException;
import com.reprise.exception.StorageUnavailableException;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheKey;
import com.reprise.model.CacheTier;
import com.reprise.model.TierLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Persistent key-value tier backed by Redis, values GZIP-compressed JSON.
 * Key pattern: {prefix}video_processed:{videoId} and {prefix}query:{videoId}:{sha256}
 */
@Slf4j
public class RedisTierStore implements TierStore {

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;
    private final RepriseProperties properties;
    private final Clock clock;

    public RedisTierStore(
            RedisTemplate<String, byte[]> redisTemplate,
            ObjectMapper objectMapper,
            RepriseProperties properties,
            Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public CacheTier tier() {
        return CacheTier.REDIS;
    }

    @Override
    public TierLookup get(CacheKey key) {
        String redisKey = buildKey(key);
        byte[] compressed;
        try {
            compressed = redisTemplate.opsForValue().get(redisKey);
        } catch (Exception e) {
            return TierLookup.error(new StorageUnavailableException(CacheTier.REDIS,
                    "Error reading from Redis: key=" + redisKey, e));
        }

        if (compressed == null) {
            log.debug("Redis tier miss: {}", redisKey);
            return TierLookup.miss();
        }

        try {
            CacheEntry entry = decompress(compressed);
            log.debug("Redis tier hit: {}", redisKey);
            return TierLookup.hit(entry.toBuilder().tierOfOrigin(CacheTier.REDIS).build());
        } catch (IOException e) {
            return TierLookup.error(new MalformedRecordException("Malformed Redis entry: key=" + redisKey, e));
        }
    }

    /**
     * Store an entry with its remaining TTL as the Redis expiry. Entries already past their
     * TTL are not written.
     */
    @Override
    public void set(CacheEntry entry) {
        String redisKey = buildKey(entry.getKey());
        Duration ttl = entry.remainingTtl(clock.instant(), properties.getCache().getTtl());
        if (ttl.isZero()) {
            log.debug("Skipping Redis write of expired entry: {}", redisKey);
            return;
        }

        try {
            byte[] compressed = compress(entry.toBuilder().tierOfOrigin(null).build());
            redisTemplate.opsForValue().set(redisKey, compressed, ttl);

            log.debug("Stored in Redis tier: key={}, ttl={}, size={}B", redisKey, ttl, compressed.length);
        } catch (Exception e) {
            throw new StorageUnavailableException(CacheTier.REDIS, "Error storing to Redis: key=" + redisKey, e);
        }
    }

    @Override
    public boolean exists(CacheKey key) {
        String redisKey = buildKey(key);
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(redisKey));
        } catch (Exception e) {
            throw new StorageUnavailableException(CacheTier.REDIS,
                    "Error checking Redis existence: key=" + redisKey, e);
        }
    }

    String buildKey(CacheKey key) {
        return properties.getCache().getRedis().getKeyPrefix() + key.encode();
    }

    private byte[] compress(CacheEntry entry) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
            gzipOut.write(objectMapper.writeValueAsBytes(entry));
        }
        return baos.toByteArray();
    }

    private CacheEntry decompress(byte[] compressed) throws IOException {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzipIn.readAllBytes(), CacheEntry.class);
        }
    }
}
