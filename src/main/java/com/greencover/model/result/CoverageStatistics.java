package com.greencover.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate coverage over a set of cities for one year. Cities whose
 * computation failed are listed in {@code failedCities} and excluded from the aggregates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CoverageStatistics implements CalculationPayload {

    private Integer year;
    private int cityCount;
    private double meanCoveragePercentage;
    private double minCoveragePercentage;
    private double maxCoveragePercentage;
    private String greenestCity;
    private String leastGreenCity;
    private double totalAreaKm2;
    private double totalVegetatedAreaKm2;

    @Builder.Default
    private List<CoverageResult> cities = new ArrayList<>();

    @Builder.Default
    private List<String> failedCities = new ArrayList<>();
}
