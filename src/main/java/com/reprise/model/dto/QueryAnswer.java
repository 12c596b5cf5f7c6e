package com.reprise.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.reprise.service.TieredCacheManager;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to a question about a video, with cache and retrieval provenance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryAnswer {

    private String videoId;

    /**
     * Null when no transcript context was available.
     */
    private String answer;

    private boolean contextAvailable;

    private boolean cached;

    @JsonIgnore
    private TieredCacheManager.CacheResult cacheResult;

    @JsonIgnore
    private boolean retrievalDegraded;

    public static QueryAnswer noContext(String videoId, boolean retrievalDegraded) {
        return QueryAnswer.builder()
                .videoId(videoId)
                .contextAvailable(false)
                .cached(false)
                .retrievalDegraded(retrievalDegraded)
                .build();
    }
}
