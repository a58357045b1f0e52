package com.greencover.service;

import com.greencover.model.CalculationRequest;
import com.greencover.model.CalculationType;
import com.greencover.model.result.CacheStats;
import com.greencover.model.result.CalculationPayload;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Wraps computations with cache lookup and write-back. Failed computations are
 * never cached; an unreachable cache store degrades to computing without caching.
 */
public interface CacheOrComputeService {

    /**
     * Cached payload for the request, or the computed one written back with the
     * type's TTL (or the request's override)
     */
    <T extends CalculationPayload> T getOrCompute(CalculationRequest request, Class<T> payloadType,
                                                  Supplier<T> computeFn);

    default <T extends CalculationPayload> T getOrCompute(CalculationType type, Map<String, Object> keyParams,
                                                          Duration ttl, Class<T> payloadType,
                                                          Supplier<T> computeFn) {
        return getOrCompute(CalculationRequest.builder()
                .calculationType(type)
                .keyParams(keyParams)
                .ttl(ttl)
                .build(), payloadType, computeFn);
    }

    /**
     * Compute unconditionally and overwrite the cached entry. Unlike
     * {@link #getOrCompute}, a cache write failure propagates.
     */
    <T extends CalculationPayload> T recompute(CalculationRequest request, Class<T> payloadType,
                                               Supplier<T> computeFn);

    String deriveKey(CalculationRequest request);

    /**
     * Remove a city's entries, of one type or of all types when {@code type} is null
     */
    int invalidate(String cityName, CalculationType type);

    /**
     * Remove a city's entries of the given types except {@code keepKey}
     */
    int invalidateStale(String cityName, Collection<CalculationType> types, String keepKey);

    int invalidateTypes(Collection<CalculationType> types);

    /**
     * Remove every satellite and statistics entry
     */
    int invalidateAllCoverage();

    List<String> cachedCities();

    int sweepExpired();

    CacheStats cacheStats();
}
