package com.greencover.repository.data.impl;

import com.greencover.config.GreenCoverProperties;
import com.greencover.exception.InvalidInputException;
import com.greencover.raster.GeoTiffRasterSource;
import com.greencover.raster.RasterSource;
import com.greencover.repository.data.RasterReader;
import com.greencover.repository.data.SourceFormat;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

@Component
public class GeoTiffRasterReader implements RasterReader {

    private final GreenCoverProperties properties;

    public GeoTiffRasterReader(GreenCoverProperties properties) {
        this.properties = properties;
    }

    @Override
    public RasterSource open(Path path) {
        try {
            return GeoTiffRasterSource.open(path, properties.getAnalysis().getDefaultRasterCrs());
        } catch (IOException e) {
            throw new InvalidInputException("Failed to open raster " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean supports(SourceFormat format) {
        return format == SourceFormat.GEOTIFF;
    }
}
