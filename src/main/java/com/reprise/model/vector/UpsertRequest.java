package com.reprise.model.vector;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Pinecone {@code POST /vectors/upsert} body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpsertRequest {

    private String namespace;

    private List<Vector> vectors;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Vector {
        private String id;
        private List<Float> values;
        private Map<String, Object> metadata;
    }
}
