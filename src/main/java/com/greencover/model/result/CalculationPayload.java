package com.greencover.model.result;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Result family stored in the cache. The {@code kind} property tags the shape
 * so a stored payload decodes back into the type that produced it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CoverageResult.class, name = "coverage"),
        @JsonSubTypes.Type(value = CoverageStatistics.class, name = "coverage-statistics"),
        @JsonSubTypes.Type(value = CoverageComparison.class, name = "coverage-comparison")
})
public interface CalculationPayload {
}
