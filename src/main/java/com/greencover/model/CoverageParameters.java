package com.greencover.model;

import com.greencover.config.GreenCoverProperties;
import lombok.Builder;
import lombok.Value;

/**
 * Analysis parameters of one coverage computation
 */
@Value
@Builder(toBuilder = true)
public class CoverageParameters {

    double ndviThreshold;
    int redBandIndex;
    int nirBandIndex;
    int year;
    String nameProperty;

    public static CoverageParameters defaults(GreenCoverProperties.Analysis analysis, int year) {
        return CoverageParameters.builder()
                .ndviThreshold(analysis.getNdviThreshold())
                .redBandIndex(analysis.getRedBandIndex())
                .nirBandIndex(analysis.getNirBandIndex())
                .nameProperty(analysis.getNameProperty())
                .year(year)
                .build();
    }

    public void validate() {
        if (Double.isNaN(ndviThreshold) || ndviThreshold < -1.0 || ndviThreshold > 1.0) {
            throw new IllegalArgumentException("NDVI threshold must be within [-1, 1], got " + ndviThreshold);
        }
        if (redBandIndex < 0 || nirBandIndex < 0) {
            throw new IllegalArgumentException("Band indices must be non-negative");
        }
        if (redBandIndex == nirBandIndex) {
            throw new IllegalArgumentException("Red and NIR band indices must differ");
        }
    }
}
