package com.reprise.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Processed-marker record stored by the flat-file tier, one file per video.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoStatusRecord {

    @JsonProperty("video_id")
    private String videoId;

    @JsonProperty("processed")
    private Boolean processed;

    @JsonProperty("created_at")
    private Instant createdAt;
}
