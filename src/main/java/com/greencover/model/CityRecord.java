package com.greencover.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * A known city with the imagery and boundary files resolved for it.
 * Paths are null when no file could be found.
 */
@Value
@Builder
public class CityRecord {

    Long id;
    String name;
    Path boundaryPath;
    Path rasterPath;

    public boolean hasImagery() {
        return boundaryPath != null && rasterPath != null;
    }
}
