package com.reprise.model;

/**
 * Kinds of cached entities.
 */
public enum EntityKind {

    VIDEO_STATUS("video_processed"),
    QUERY_RESPONSE("query");

    private final String prefix;

    EntityKind(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }
}
