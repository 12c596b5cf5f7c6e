package com.reprise.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Self-describing query record stored by the flat-file tier, one file per (video, fingerprint).
 * The approximate matcher enumerates these to find paraphrased questions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRecord {

    @JsonProperty("video_id")
    private String videoId;

    /**
     * Normalized query text.
     */
    @JsonProperty("query")
    private String query;

    @JsonProperty("response")
    private String response;

    @JsonProperty("created_at")
    private Instant createdAt;
}
