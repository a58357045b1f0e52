package com.greencover.repository.data;

import com.greencover.raster.RasterSource;

import java.nio.file.Path;

/**
 * Opens georeferenced multi-band rasters. Callers close the returned source.
 */
public interface RasterReader {

    RasterSource open(Path path);

    boolean supports(SourceFormat format);
}
