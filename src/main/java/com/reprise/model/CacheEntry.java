package com.reprise.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * One cached value as it moves between tiers.
 * Video-status entries carry {@code processed}; query-response entries carry the
 * normalized query text and the response.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    private EntityKind kind;

    private String videoId;

    /**
     * Query fingerprint, null for video-status entries.
     */
    private String fingerprint;

    private Boolean processed;

    private String queryText;

    private String response;

    private Instant createdAt;

    /**
     * Tier the entry was read from. Not persisted.
     */
    @JsonIgnore
    private CacheTier tierOfOrigin;

    public static CacheEntry videoProcessed(String videoId, Instant createdAt) {
        return CacheEntry.builder()
                .kind(EntityKind.VIDEO_STATUS)
                .videoId(videoId)
                .processed(true)
                .createdAt(createdAt)
                .build();
    }

    public static CacheEntry queryResponse(CacheKey key, String queryText, String response, Instant createdAt) {
        return CacheEntry.builder()
                .kind(EntityKind.QUERY_RESPONSE)
                .videoId(key.getVideoId())
                .fingerprint(key.getFingerprint())
                .queryText(queryText)
                .response(response)
                .createdAt(createdAt)
                .build();
    }

    @JsonIgnore
    public CacheKey getKey() {
        if (kind == EntityKind.VIDEO_STATUS) {
            return CacheKey.videoStatus(videoId);
        }
        return CacheKey.queryResponse(videoId, fingerprint);
    }

    /**
     * An entry is valid iff {@code now - createdAt < ttl}.
     */
    public boolean isValidAt(Instant now, Duration ttl) {
        return createdAt != null && Duration.between(createdAt, now).compareTo(ttl) < 0;
    }

    public Duration remainingTtl(Instant now, Duration ttl) {
        if (createdAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = ttl.minus(Duration.between(createdAt, now));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
