package com.greencover.repository.data;

import com.greencover.model.BoundaryCollection;

import java.nio.file.Path;

/**
 * Reads named boundary polygons from a file
 */
public interface BoundaryReader {

    /**
     * @param nameProperty feature property holding the city name
     */
    BoundaryCollection read(Path path, String nameProperty);

    boolean supports(SourceFormat format);
}
