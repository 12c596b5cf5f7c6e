package com.reprise.model.dto;

import com.reprise.model.SearchMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    private String query;

    private SearchMethod searchMethod;

    /**
     * Chat model for this question; the configured one when absent.
     */
    private String model;
}
