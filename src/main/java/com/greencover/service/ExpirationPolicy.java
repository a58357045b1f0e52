package com.greencover.service;

import com.greencover.config.GreenCoverProperties;
import com.greencover.model.CalculationType;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Time-to-live per calculation type: satellite analyses 72 hours, aggregate
 * statistics 12 hours, everything else 24 hours unless configured otherwise
 */
@Component
public class ExpirationPolicy {

    private final GreenCoverProperties.Cache cache;

    public ExpirationPolicy(GreenCoverProperties properties) {
        this.cache = properties.getCache();
    }

    public Duration ttlFor(CalculationType type) {
        switch (type.getKind()) {
            case SATELLITE:
                return cache.getSatelliteTtl();
            case STATS:
                return cache.getStatsTtl();
            case CUSTOM:
                return cache.getCustomTtls().getOrDefault(type.getTag(), cache.getDefaultTtl());
            default:
                return cache.getDefaultTtl();
        }
    }

    /**
     * @param override per-call TTL, null to use the type default
     */
    public Instant expiresAt(CalculationType type, Instant now, Duration override) {
        Duration ttl = override != null ? override : ttlFor(type);
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must not be negative: " + ttl);
        }
        return now.plus(ttl);
    }
}
