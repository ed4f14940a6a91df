package com.example.mmocore.persistence;

/**
 * External key-value store for player profiles. Only written on disconnect.
 */
public interface ProfileStore {

    /**
     * Persist allocated attributes and the remaining stat-point balance.
     * May block; callers go through {@link ProfileWriter}.
     *
     * @throws ProfileStoreException if the write fails
     */
    void save(ProfileSnapshot snapshot);
}
