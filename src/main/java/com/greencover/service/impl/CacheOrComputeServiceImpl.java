package com.greencover.service.impl;

import com.greencover.config.GreenCoverProperties;
import com.greencover.exception.CacheUnavailableException;
import com.greencover.model.CacheEntry;
import com.greencover.model.CalculationRequest;
import com.greencover.model.CalculationType;
import com.greencover.model.result.CacheStats;
import com.greencover.model.result.CalculationPayload;
import com.greencover.repository.CacheStore;
import com.greencover.service.CacheKeyGenerator;
import com.greencover.service.CacheOrComputeService;
import com.greencover.service.ExpirationPolicy;
import com.greencover.service.PayloadCodec;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

@Service
public class CacheOrComputeServiceImpl implements CacheOrComputeService {

    private static final Logger logger = LoggerFactory.getLogger(CacheOrComputeServiceImpl.class);

    static final String LOOKUP_COUNTER = "greencover.cache.lookups";

    private final CacheStore cacheStore;
    private final CacheKeyGenerator keyGenerator;
    private final ExpirationPolicy expirationPolicy;
    private final PayloadCodec payloadCodec;
    private final Clock clock;
    private final int sweepEveryWrites;

    private final Counter hits;
    private final Counter misses;
    private final Counter bypasses;
    private final AtomicLong writes = new AtomicLong();

    public CacheOrComputeServiceImpl(CacheStore cacheStore, CacheKeyGenerator keyGenerator,
                                     ExpirationPolicy expirationPolicy, PayloadCodec payloadCodec, Clock clock,
                                     MeterRegistry meterRegistry, GreenCoverProperties properties) {
        this.cacheStore = cacheStore;
        this.keyGenerator = keyGenerator;
        this.expirationPolicy = expirationPolicy;
        this.payloadCodec = payloadCodec;
        this.clock = clock;
        this.sweepEveryWrites = properties.getCache().getSweepEveryWrites();
        this.hits = lookupCounter(meterRegistry, "hit");
        this.misses = lookupCounter(meterRegistry, "miss");
        this.bypasses = lookupCounter(meterRegistry, "bypass");
    }

    private static Counter lookupCounter(MeterRegistry registry, String result) {
        return Counter.builder(LOOKUP_COUNTER)
                .description("Cache lookups by result")
                .tag("result", result)
                .register(registry);
    }

    @Override
    public <T extends CalculationPayload> T getOrCompute(CalculationRequest request, Class<T> payloadType,
                                                         Supplier<T> computeFn) {
        String key = deriveKey(request);

        Optional<CacheEntry> cached;
        try {
            cached = cacheStore.get(key);
        } catch (CacheUnavailableException e) {
            bypasses.increment();
            logger.warn("Cache unavailable, computing {} for {} without caching: {}",
                    request.getCalculationType(), request.getCityName(), e.getMessage());
            return computeFn.get();
        }

        if (cached.isPresent()) {
            Optional<T> payload = payloadCodec.decode(cached.get().getPayload(), payloadType);
            if (payload.isPresent()) {
                hits.increment();
                logger.debug("Cache hit for {} {} ({})", request.getCalculationType(), request.getCityName(), key);
                return payload.get();
            }
            logger.warn("Discarding corrupted cache entry {} for {}", key, request.getCityName());
            deleteQuietly(key);
        }

        misses.increment();
        logger.info("Cache miss for {} {}, computing", request.getCalculationType(), request.getCityName());
        T value = computeFn.get();
        try {
            write(key, request, value);
        } catch (CacheUnavailableException e) {
            logger.warn("Cache unavailable, result for {} not cached: {}", request.getCityName(), e.getMessage());
        }
        return value;
    }

    @Override
    public <T extends CalculationPayload> T recompute(CalculationRequest request, Class<T> payloadType,
                                                      Supplier<T> computeFn) {
        String key = deriveKey(request);
        logger.info("Recomputing {} for {}", request.getCalculationType(), request.getCityName());
        T value = computeFn.get();
        write(key, request, value);
        return value;
    }

    @Override
    public String deriveKey(CalculationRequest request) {
        return keyGenerator.generate(request.getCalculationType(), request.getKeyParams());
    }

    private void write(String key, CalculationRequest request, CalculationPayload value) {
        Instant now = clock.instant();
        cacheStore.put(CacheEntry.builder()
                .id(key)
                .calculationType(request.getCalculationType())
                .cityId(request.getCityId())
                .cityName(request.getCityName())
                .payload(payloadCodec.encode(value))
                .createdAt(now)
                .expiresAt(expirationPolicy.expiresAt(request.getCalculationType(), now, request.getTtl()))
                .build());
        maybeSweep();
    }

    private void maybeSweep() {
        if (sweepEveryWrites <= 0 || writes.incrementAndGet() % sweepEveryWrites != 0) {
            return;
        }
        try {
            int removed = cacheStore.deleteExpired();
            logger.debug("Opportunistic sweep removed {} expired entries", removed);
        } catch (RuntimeException e) {
            logger.warn("Opportunistic cache sweep failed: {}", e.getMessage());
        }
    }

    private void deleteQuietly(String key) {
        try {
            cacheStore.delete(key);
        } catch (CacheUnavailableException e) {
            logger.warn("Could not delete cache entry {}: {}", key, e.getMessage());
        }
    }

    @Override
    public int invalidate(String cityName, CalculationType type) {
        int removed = cacheStore.deleteByCity(cityName, type);
        logger.info("Invalidated {} cache entries for {} (type {})", removed, cityName, type == null ? "all" : type);
        return removed;
    }

    @Override
    public int invalidateStale(String cityName, Collection<CalculationType> types, String keepKey) {
        int removed = cacheStore.deleteByCity(cityName, types, keepKey);
        if (removed > 0) {
            logger.info("Invalidated {} stale {} entries for {}", removed, types, cityName);
        }
        return removed;
    }

    @Override
    public int invalidateTypes(Collection<CalculationType> types) {
        int removed = cacheStore.deleteByType(types);
        logger.info("Invalidated {} cache entries of types {}", removed, types);
        return removed;
    }

    @Override
    public int invalidateAllCoverage() {
        return invalidateTypes(Set.of(CalculationType.SATELLITE, CalculationType.STATS));
    }

    @Override
    public List<String> cachedCities() {
        return cacheStore.cityNames();
    }

    @Override
    public int sweepExpired() {
        int removed = cacheStore.deleteExpired();
        logger.info("Removed {} expired cache entries", removed);
        return removed;
    }

    @Override
    public CacheStats cacheStats() {
        return cacheStore.stats();
    }
}
