package com.greencover.model.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Summary of a boundary file used to pick the name property and check coverage of a region
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoundarySourceInfo {

    private String source;
    private String format;
    private int featureCount;
    private String crs;
    private String nameProperty;
    private double minX;
    private double minY;
    private double maxX;
    private double maxY;
    private List<String> propertyNames;
    private List<String> geometryTypes;

    /**
     * Up to ten feature names, in source order
     */
    private List<String> sampleNames;
}
