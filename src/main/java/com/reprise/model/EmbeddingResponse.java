package com.reprise.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI embeddings response. One data element per input, tagged with the input's index.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingResponse {

    @JsonProperty("model")
    private String model;

    @JsonProperty("data")
    private List<EmbeddingData> data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EmbeddingData {

        @JsonProperty("index")
        private int index;

        @JsonProperty("embedding")
        private List<Float> embedding;
    }
}
