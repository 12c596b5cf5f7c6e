package com.reprise.exception;

import com.reprise.model.CacheTier;

/**
 * A cache tier could not be read or written.
 */
public class StorageUnavailableException extends RuntimeException {

    private final CacheTier tier;

    public StorageUnavailableException(CacheTier tier, String message, Throwable cause) {
        super(message, cause);
        this.tier = tier;
    }

    public CacheTier getTier() {
        return tier;
    }
}
