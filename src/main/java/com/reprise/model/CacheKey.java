package com.reprise.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable cache key: entity kind, video id and, for query responses, the query fingerprint.
 * Encoded form: {@code video_processed:{videoId}} or {@code query:{videoId}:{fingerprint}}.
 */
@Getter
@EqualsAndHashCode
public final class CacheKey {

    private static final Pattern VIDEO_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,128}");
    private static final Pattern FINGERPRINT_PATTERN = Pattern.compile("[0-9a-f]{64}");

    private final EntityKind kind;
    private final String videoId;
    private final String fingerprint;

    private CacheKey(EntityKind kind, String videoId, String fingerprint) {
        this.kind = kind;
        this.videoId = videoId;
        this.fingerprint = fingerprint;
    }

    public static CacheKey videoStatus(String videoId) {
        return new CacheKey(EntityKind.VIDEO_STATUS, requireVideoId(videoId), null);
    }

    public static CacheKey queryResponse(String videoId, String fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        if (!FINGERPRINT_PATTERN.matcher(fingerprint).matches()) {
            throw new IllegalArgumentException("Fingerprint must be 64 lowercase hex chars: " + fingerprint);
        }
        return new CacheKey(EntityKind.QUERY_RESPONSE, requireVideoId(videoId), fingerprint);
    }

    /**
     * Video ids end up in file names and Redis keys, so only a safe alphabet is accepted.
     */
    public static String requireVideoId(String videoId) {
        if (videoId == null || !VIDEO_ID_PATTERN.matcher(videoId).matches()) {
            throw new IllegalArgumentException("Invalid video id: " + videoId);
        }
        return videoId;
    }

    public static boolean isValidVideoId(String videoId) {
        return videoId != null && VIDEO_ID_PATTERN.matcher(videoId).matches();
    }

    public String encode() {
        if (kind == EntityKind.VIDEO_STATUS) {
            return kind.getPrefix() + ":" + videoId;
        }
        return kind.getPrefix() + ":" + videoId + ":" + fingerprint;
    }

    @Override
    public String toString() {
        return encode();
    }
}
