package com.reprise.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexResult {

    private String videoId;

    /**
     * False when the video was already processed and indexing was skipped.
     */
    private boolean indexed;

    private int passageCount;
}
