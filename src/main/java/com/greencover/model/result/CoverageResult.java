package com.greencover.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Green coverage of one city boundary from one raster
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CoverageResult implements CalculationPayload {

    private String cityName;
    private double coveragePercentage;
    private long totalPixels;
    private long vegetatedPixels;
    private double totalAreaM2;
    private double vegetatedAreaM2;
    private double totalAreaKm2;
    private double vegetatedAreaKm2;
    private double meanNdvi;
    private double stdNdvi;
    private double minNdvi;
    private double maxNdvi;
    private double ndviThreshold;
    private String coordinateSystem;
    private Integer year;
    private String measurementMethod;
    private String dataSource;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
