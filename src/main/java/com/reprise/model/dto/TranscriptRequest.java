package com.reprise.model.dto;

import com.reprise.model.Passage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Already-chunked transcript passages for one video.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptRequest {

    private List<Passage> passages;

    /**
     * Re-index even if the video is already marked processed.
     */
    private boolean force;
}
