package com.greencover.repository.impl;

import com.greencover.model.CacheEntry;
import com.greencover.model.CalculationType;
import com.greencover.model.result.CacheStats;
import com.greencover.repository.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local cache store on a {@link ConcurrentHashMap}. Entries are lost on restart.
 */
@Repository
@ConditionalOnProperty(prefix = "greencover.cache", name = "store", havingValue = "memory")
public class InMemoryCacheStore implements CacheStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCacheStore.class);

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void put(CacheEntry entry) {
        Objects.requireNonNull(entry.getKey(), "cache key");
        entries.put(entry.getKey(), entry);
        logger.debug("Stored cache entry {} ({}, {})", entry.getKey(), entry.getCalculationType(),
                entry.getCityName());
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            // only drop the entry we saw, a concurrent put may have replaced it
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public int deleteExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Removed {} expired cache entries", removed);
        }
        return removed;
    }

    @Override
    public int deleteByCity(String cityName, Collection<CalculationType> types, String keepKey) {
        int removed = 0;
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            CacheEntry entry = e.getValue();
            if (!entry.belongsTo(cityName) || e.getKey().equals(keepKey)) {
                continue;
            }
            if (types != null && !types.isEmpty() && !types.contains(entry.getCalculationType())) {
                continue;
            }
            if (entries.remove(e.getKey(), entry)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int deleteByType(Collection<CalculationType> types) {
        int removed = 0;
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            if (types.contains(e.getValue().getCalculationType()) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public List<String> cityNames() {
        return entries.values().stream()
                .map(CacheEntry::getCityName)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(() -> new TreeSet<>(String.CASE_INSENSITIVE_ORDER)))
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public CacheStats stats() {
        Instant now = clock.instant();
        long total = 0;
        long expired = 0;
        Map<String, Long> byType = new TreeMap<>();
        for (CacheEntry entry : entries.values()) {
            total++;
            if (entry.isExpired(now)) {
                expired++;
            }
            byType.merge(entry.getCalculationType().getTag(), 1L, Long::sum);
        }
        return CacheStats.builder()
                .totalEntries(total)
                .validEntries(total - expired)
                .expiredEntries(expired)
                .entriesByType(byType)
                .build();
    }
}
