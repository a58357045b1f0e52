package com.greencover.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Descriptor of a cacheable calculation: its type, the parameters that
 * identify it, the city it belongs to and an optional TTL override
 */
@Value
@Builder
public class CalculationRequest {

    CalculationType calculationType;

    @Singular
    Map<String, Object> keyParams;

    Long cityId;

    String cityName;

    /**
     * Overrides the type's default TTL when set
     */
    Duration ttl;
}
