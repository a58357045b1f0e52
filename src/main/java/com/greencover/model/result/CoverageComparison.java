package com.greencover.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Side-by-side coverage of two cities. Differences are first minus second.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CoverageComparison implements CalculationPayload {

    private Integer year;
    private CoverageResult first;
    private CoverageResult second;
    private double coverageDifference;
    private double vegetatedAreaDifferenceKm2;
    private double meanNdviDifference;

    /**
     * Name of the greener city, null on a tie
     */
    private String greenerCity;
}
