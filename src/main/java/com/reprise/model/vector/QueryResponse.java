package com.reprise.model.vector;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Pinecone {@code POST /query} response. Matches are ordered best first.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    private String namespace;

    private List<Match> matches;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Match {
        private String id;
        private double score;
        private Map<String, Object> metadata;
    }
}
