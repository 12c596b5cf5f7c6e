package com.reprise.repository;

import com.reprise.model.CacheEntry;
import com.reprise.model.CacheKey;
import com.reprise.model.CacheTier;
import com.reprise.model.TierLookup;

/**
 * Uniform storage primitive over one cache tier. No cross-tier logic lives here.
 * Stores do not judge TTL validity; the cache manager does, against its clock.
 */
public interface TierStore {

    /**
     * @return the tier this store backs
     */
    CacheTier tier();

    /**
     * Read one key. Never throws: failures come back as {@link TierLookup.Status#ERROR}.
     *
     * @param key cache key
     * @return hit, miss or error
     */
    TierLookup get(CacheKey key);

    /**
     * Write (or overwrite) an entry under its own key.
     *
     * @param entry entry with key fields and createdAt set
     * @throws com.reprise.exception.StorageUnavailableException if the tier cannot be written
     */
    void set(CacheEntry entry);

    /**
     * @param key cache key
     * @return true if some entry, valid or not, is stored under the key
     * @throws com.reprise.exception.StorageUnavailableException if the tier cannot be read
     */
    boolean exists(CacheKey key);

    /**
     * Whether this tier is the durability source of truth. A failed write to a durable
     * tier fails the whole write-through.
     */
    default boolean isDurable() {
        return false;
    }
}
