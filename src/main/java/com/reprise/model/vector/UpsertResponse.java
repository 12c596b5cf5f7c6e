package com.reprise.model.vector;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pinecone {@code POST /vectors/upsert} response.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpsertResponse {

    private int upsertedCount;
}
