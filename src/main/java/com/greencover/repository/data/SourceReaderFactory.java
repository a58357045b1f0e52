package com.greencover.repository.data;

import com.greencover.exception.UnsupportedFormatException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Picks the reader for a file by its detected format. Unsupported formats fail
 * here, before any file is opened.
 */
@Component
public class SourceReaderFactory {

    private final List<BoundaryReader> boundaryReaders;
    private final List<RasterReader> rasterReaders;

    public SourceReaderFactory(List<BoundaryReader> boundaryReaders, List<RasterReader> rasterReaders) {
        this.boundaryReaders = boundaryReaders;
        this.rasterReaders = rasterReaders;
    }

    public BoundaryReader boundaryReader(Path path) {
        SourceFormat format = checkCategory(path, SourceFormat.Category.BOUNDARY);
        return boundaryReaders.stream()
                .filter(reader -> reader.supports(format))
                .findFirst()
                .orElseThrow(() -> new UnsupportedFormatException("Boundary format " + format + " of "
                        + path.getFileName() + " is not supported; convert it to GeoJSON"));
    }

    public RasterReader rasterReader(Path path) {
        SourceFormat format = checkCategory(path, SourceFormat.Category.RASTER);
        return rasterReaders.stream()
                .filter(reader -> reader.supports(format))
                .findFirst()
                .orElseThrow(() -> new UnsupportedFormatException("Raster format " + format + " of "
                        + path.getFileName() + " is not supported; convert it to GeoTIFF"));
    }

    public boolean isSupported(Path path) {
        try {
            SourceFormat format = SourceFormat.fromPath(path);
            return format.getCategory() == SourceFormat.Category.BOUNDARY
                    ? boundaryReaders.stream().anyMatch(r -> r.supports(format))
                    : rasterReaders.stream().anyMatch(r -> r.supports(format));
        } catch (UnsupportedFormatException e) {
            return false;
        }
    }

    private static SourceFormat checkCategory(Path path, SourceFormat.Category expected) {
        SourceFormat format = SourceFormat.fromPath(path);
        if (format.getCategory() != expected) {
            throw new UnsupportedFormatException(path.getFileName() + " is a " + format.getCategory().name()
                    .toLowerCase(Locale.ROOT) + " file, expected a " + expected.name().toLowerCase(Locale.ROOT) + " file");
        }
        return format;
    }
}
