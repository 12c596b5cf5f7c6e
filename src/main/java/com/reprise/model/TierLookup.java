package com.reprise.model;

import lombok.Getter;

/**
 * Outcome of reading one key from one tier. A miss is a normal outcome and is kept
 * apart from an error so callers can decide whether to log.
 */
@Getter
public final class TierLookup {

    public enum Status {
        HIT,
        MISS,
        ERROR
    }

    private static final TierLookup MISS = new TierLookup(Status.MISS, null, null);

    private final Status status;
    private final CacheEntry entry;
    private final Exception error;

    private TierLookup(Status status, CacheEntry entry, Exception error) {
        this.status = status;
        this.entry = entry;
        this.error = error;
    }

    public static TierLookup hit(CacheEntry entry) {
        return new TierLookup(Status.HIT, entry, null);
    }

    public static TierLookup miss() {
        return MISS;
    }

    public static TierLookup error(Exception error) {
        return new TierLookup(Status.ERROR, null, error);
    }

    public boolean isHit() {
        return status == Status.HIT;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }
}
