package com.reprise.model.vector;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Pinecone {@code POST /query} body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryRequest {

    private String namespace;

    private List<Float> vector;

    private int topK;

    private boolean includeMetadata;

    private boolean includeValues;
}
