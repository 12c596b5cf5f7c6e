package com.reprise.model;

import java.util.Locale;

/**
 * Summary length presets with the completion token limit used for each.
 */
public enum SummaryLength {

    SHORT(100, "Summarize the video briefly in 2-3 sentences."),
    MEDIUM(250, "Summarize the main points of the video."),
    DETAILED(500, "Write a detailed summary of the video content.");

    private final int maxTokens;
    private final String instruction;

    SummaryLength(int maxTokens, String instruction) {
        this.maxTokens = maxTokens;
        this.instruction = instruction;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public String getInstruction() {
        return instruction;
    }

    /**
     * Query text the summary is cached under.
     */
    public String cacheQuery() {
        return "summarize " + name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether a normalized query is the cache key of some summary.
     */
    public static boolean isCacheQuery(String normalizedQuery) {
        for (SummaryLength length : values()) {
            if (length.cacheQuery().equals(normalizedQuery)) {
                return true;
            }
        }
        return false;
    }
}
