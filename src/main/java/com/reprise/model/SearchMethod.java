package com.reprise.model;

import com.reprise.config.RepriseProperties;

/**
 * Retrieval mode requested by a caller, mapped to a dense/lexical weight.
 */
public enum SearchMethod {

    HYBRID,
    VECTOR,
    KEYWORD;

    public double vectorWeight(RepriseProperties.RetrievalConfig config) {
        switch (this) {
            case VECTOR:
                return 1.0;
            case KEYWORD:
                return 0.0;
            default:
                return config.getHybridVectorWeight();
        }
    }
}
