package com.greencover.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Named boundary features loaded from one source file
 */
@Value
@Builder
public class BoundaryCollection {

    String source;

    String crs;

    String nameProperty;

    @Singular
    List<BoundaryGeometry> features;

    public List<String> names() {
        return features.stream()
                .map(BoundaryGeometry::getName)
                .filter(name -> name != null)
                .collect(Collectors.toList());
    }
}
