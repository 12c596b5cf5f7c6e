package com.reprise.model.dto;

import com.reprise.model.SummaryLength;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryResult {

    private String videoId;

    private SummaryLength length;

    /**
     * Empty when the transcript yielded no context.
     */
    private String summary;

    private boolean cached;
}
