package com.greencover.model.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * Entry counts of the cache store at one instant
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private long totalEntries;
    private long validEntries;
    private long expiredEntries;

    /**
     * Entry count per calculation type tag
     */
    @Builder.Default
    private Map<String, Long> entriesByType = new TreeMap<>();
}
