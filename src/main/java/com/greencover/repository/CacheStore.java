package com.greencover.repository;

import com.greencover.model.CacheEntry;
import com.greencover.model.CalculationType;
import com.greencover.model.result.CacheStats;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Key to payload store with per-entry expiration. Payloads are opaque text.
 * <p>
 * An entry whose expiration has passed is a miss on {@link #get(String)} even
 * before a sweep removes it. Writing an existing key replaces the entry as a
 * whole; concurrent writers of one key settle on the last write.
 */
public interface CacheStore {

    /**
     * Insert or overwrite the entry with {@code entry.getKey()}
     */
    void put(CacheEntry entry);

    default void put(String key, CalculationType type, Long cityId, String cityName, String payload,
                     Instant createdAt, Instant expiresAt) {
        put(CacheEntry.builder()
                .id(key)
                .calculationType(type)
                .cityId(cityId)
                .cityName(cityName)
                .payload(payload)
                .createdAt(createdAt)
                .expiresAt(expiresAt)
                .build());
    }

    /**
     * Live entry for the key, empty when absent or expired
     */
    Optional<CacheEntry> get(String key);

    boolean delete(String key);

    /**
     * Remove every expired entry
     *
     * @return number of entries removed
     */
    int deleteExpired();

    /**
     * Remove entries of a city, matched case-insensitively by name, optionally
     * restricted to some calculation types and sparing one key
     *
     * @param types    types to remove, null or empty for all
     * @param keepKey  key to keep, may be null
     * @return number of entries removed
     */
    int deleteByCity(String cityName, Collection<CalculationType> types, String keepKey);

    default int deleteByCity(String cityName) {
        return deleteByCity(cityName, null, null);
    }

    default int deleteByCity(String cityName, CalculationType type) {
        return deleteByCity(cityName, type == null ? null : Set.of(type), null);
    }

    /**
     * Remove every entry of the given types regardless of city
     */
    int deleteByType(Collection<CalculationType> types);

    /**
     * Distinct city names with at least one entry, sorted
     */
    List<String> cityNames();

    CacheStats stats();
}
